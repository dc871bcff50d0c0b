package com.sandy.aiot.vision.sentinel.controller;

import com.jayway.jsonpath.JsonPath;
import com.sandy.aiot.vision.sentinel.entity.Device;
import com.sandy.aiot.vision.sentinel.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SiteDeviceControllerApiTest {
    @Autowired MockMvc mockMvc;
    @Autowired SiteRepository siteRepository;
    @Autowired DeviceRepository deviceRepository;
    @Autowired SampleRepository sampleRepository;
    @Autowired AnomalyEventRepository eventRepository;
    @Autowired AlertRuleRepository ruleRepository;
    @Autowired AlertEventRepository alertEventRepository;

    @BeforeEach
    void setUp() {
        alertEventRepository.deleteAll();
        ruleRepository.deleteAll();
        eventRepository.deleteAll();
        sampleRepository.deleteAll();
        deviceRepository.deleteAll();
        siteRepository.deleteAll();
    }

    private long createSite(String body) throws Exception {
        String json = mockMvc.perform(post("/api/sites").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return ((Number) JsonPath.read(json, "$.id")).longValue();
    }

    @Test
    void sitesAreCreatedAndListed() throws Exception {
        createSite("{\"name\":\"Depot\",\"tz\":\"America/Toronto\"}");
        createSite("{\"name\":\"Warehouse\"}");

        mockMvc.perform(get("/api/sites"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].name", is("Depot")))
                .andExpect(jsonPath("$[0].tz", is("America/Toronto")))
                .andExpect(jsonPath("$[1].tz", is("UTC")));
    }

    @Test
    void siteNeedsNameAndKnownZone() throws Exception {
        mockMvc.perform(post("/api/sites").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success", is(false)));

        mockMvc.perform(post("/api/sites").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"Moon base\",\"tz\":\"Mars/Olympus\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("Mars/Olympus")));

        mockMvc.perform(get("/api/sites")).andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void devicesDefaultToRealtimeAndFilterBySiteTypeAndActivity() throws Exception {
        long siteId = createSite("{\"name\":\"Depot\"}");
        long otherSiteId = createSite("{\"name\":\"Annex\"}");

        mockMvc.perform(post("/api/devices").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"site_id\":" + siteId + ",\"name\":\"Main meter\",\"type\":\"power\",\"unit\":\"W\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.site_id", is((int) siteId)))
                .andExpect(jsonPath("$.capabilities", contains("realtime")))
                .andExpect(jsonPath("$.active", is(true)));
        mockMvc.perform(post("/api/devices").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"site_id\":" + siteId + ",\"name\":\"Cold room\",\"type\":\"temp\",\"capabilities\":[\"historical\",\"alarms\"]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.capabilities", containsInAnyOrder("historical", "alarms")));
        deviceRepository.save(Device.builder().siteId(siteId).name("Retired meter").type("power").active(false).build());
        deviceRepository.save(Device.builder().siteId(otherSiteId).name("Annex meter").type("power").build());

        mockMvc.perform(get("/api/devices").param("site_id", String.valueOf(siteId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[*].name", contains("Main meter", "Cold room")));
        mockMvc.perform(get("/api/devices").param("site_id", String.valueOf(siteId)).param("active", "false"))
                .andExpect(jsonPath("$", hasSize(3)));
        mockMvc.perform(get("/api/devices").param("site_id", String.valueOf(siteId)).param("type", "power"))
                .andExpect(jsonPath("$[*].name", contains("Main meter")));
        mockMvc.perform(get("/api/devices"))
                .andExpect(jsonPath("$", hasSize(3)));
    }

    @Test
    void deviceNeedsExistingSiteNameAndType() throws Exception {
        long siteId = createSite("{\"name\":\"Depot\"}");

        mockMvc.perform(post("/api/devices").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"site_id\":" + (siteId + 999) + ",\"name\":\"Meter\",\"type\":\"power\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("Unknown site")));
        mockMvc.perform(post("/api/devices").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"site_id\":" + siteId + ",\"name\":\"Meter\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success", is(false)));
    }
}
