package com.sunpath.planner.api;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sunpath.planner.model.DaylightInfo;
import com.sunpath.planner.model.SolarPosition;
import com.sunpath.planner.model.TwilightType;
import com.sunpath.planner.model.TwilightWindow;
import com.sunpath.planner.service.SolarService;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = SolarController.class)
@AutoConfigureMockMvc(addFilters = false)
class SolarControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private SolarService solarService;

  @Test
  void position_returns200() throws Exception {
    when(solarService.position(eq("51.5"), eq("0"), eq(null)))
        .thenReturn(new SolarPosition(180.0, 62.0, 28.0, 1.0, 6.0, 23.4));

    mockMvc.perform(get("/api/sun/position").param("lat", "51.5").param("lon", "0"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.azimuth").value(180.0))
        .andExpect(jsonPath("$.altitude").value(62.0))
        .andExpect(jsonPath("$.declination").value(23.4));
  }

  @Test
  void daylight_returns200() throws Exception {
    DaylightInfo payload = new DaylightInfo(
        Instant.parse("2024-06-21T09:25:00Z"),
        Instant.parse("2024-06-22T00:31:00Z"),
        Instant.parse("2024-06-21T16:57:00Z"),
        Instant.parse("2024-06-22T04:57:00Z"),
        Instant.parse("2024-06-21T08:52:00Z"),
        Instant.parse("2024-06-22T01:04:00Z"),
        15.1,
        8.9,
        false,
        false);
    when(solarService.daylight(eq("40.7128"), eq("-74.006"), eq("2024-06-21"))).thenReturn(payload);

    mockMvc.perform(get("/api/sun/daylight")
            .param("lat", "40.7128")
            .param("lon", "-74.006")
            .param("date", "2024-06-21"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sunrise").value("2024-06-21T09:25:00Z"))
        .andExpect(jsonPath("$.dayLength").value(15.1))
        .andExpect(jsonPath("$.alwaysDay").value(false));
  }

  @Test
  void daylight_polarDaySerializesNullEvents() throws Exception {
    DaylightInfo payload = new DaylightInfo(
        null,
        null,
        Instant.parse("2024-06-21T12:00:00Z"),
        Instant.parse("2024-06-22T00:00:00Z"),
        null,
        null,
        24.0,
        0.0,
        true,
        false);
    when(solarService.daylight(eq("70"), eq("0"), eq(null))).thenReturn(payload);

    mockMvc.perform(get("/api/sun/daylight").param("lat", "70").param("lon", "0"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sunrise").doesNotExist())
        .andExpect(jsonPath("$.alwaysDay").value(true));
  }

  @Test
  void twilight_returns200() throws Exception {
    when(solarService.twilight(eq("60"), eq("0"), eq(null), eq("astronomical")))
        .thenReturn(new TwilightWindow(TwilightType.ASTRONOMICAL, null, null));

    mockMvc.perform(get("/api/sun/twilight").param("lat", "60").param("lon", "0").param("type", "astronomical"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.type").value("ASTRONOMICAL"));
  }

  @Test
  void invalidInput_returns400() throws Exception {
    when(solarService.position(eq("abc"), eq("0"), eq(null)))
        .thenThrow(new InvalidInputException("lat must be numeric"));

    mockMvc.perform(get("/api/sun/position").param("lat", "abc").param("lon", "0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_input"))
        .andExpect(jsonPath("$.message").value("lat must be numeric"));
  }

  @Test
  void outOfRangeLongitude_returns400() throws Exception {
    when(solarService.position(eq("0"), eq("500"), eq(null)))
        .thenThrow(new InvalidInputException("longitude must be within [-180,180]"));

    mockMvc.perform(get("/api/sun/position").param("lat", "0").param("lon", "500"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_input"))
        .andExpect(jsonPath("$.message").value("longitude must be within [-180,180]"));
  }

  @Test
  void unexpectedFailure_returns500() throws Exception {
    when(solarService.position(eq("1"), eq("1"), eq(null))).thenThrow(new IllegalStateException("boom"));

    mockMvc.perform(get("/api/sun/position").param("lat", "1").param("lon", "1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("internal_error"));
  }

  @Test
  void unknownRoute_returns404() throws Exception {
    mockMvc.perform(get("/api/sun/unknown"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("not_found"));
  }
}
