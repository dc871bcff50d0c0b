package com.sandy.aiot.vision.sentinel.controller;

import com.sandy.aiot.vision.sentinel.entity.Device;
import com.sandy.aiot.vision.sentinel.entity.Site;
import com.sandy.aiot.vision.sentinel.repository.*;
import com.sandy.aiot.vision.sentinel.support.MutableClock;
import com.sandy.aiot.vision.sentinel.support.RecordingNotificationDispatcher;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AlertControllerApiTest {
    @Autowired MockMvc mockMvc;
    @Autowired SiteRepository siteRepository;
    @Autowired DeviceRepository deviceRepository;
    @Autowired SampleRepository sampleRepository;
    @Autowired AlertRuleRepository ruleRepository;
    @Autowired AlertEventRepository alertEventRepository;
    @Autowired AnomalyEventRepository eventRepository;
    @Autowired MutableClock clock;
    @Autowired RecordingNotificationDispatcher dispatcher;

    private Site site;
    private Device meter;

    @BeforeEach
    void setUp() {
        clock.setUtc(LocalDateTime.of(2026, 3, 1, 12, 0));
        dispatcher.reset();
        alertEventRepository.deleteAll();
        ruleRepository.deleteAll();
        eventRepository.deleteAll();
        sampleRepository.deleteAll();
        deviceRepository.deleteAll();
        siteRepository.deleteAll();
        site = siteRepository.save(Site.builder().name("HQ").build());
        meter = deviceRepository.save(Device.builder().siteId(site.getId()).name("Meter").type("power").build());
    }

    private long createPreset() throws Exception {
        String body = "{\"site_id\":" + site.getId() + ",\"preset_type\":\"high_draw\",\"device_ids\":[" + meter.getId() + "],\"threshold\":1500}";
        String json = mockMvc.perform(post("/api/alerts").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return ((Number) JsonPath.read(json, "$.id")).longValue();
    }

    @Test
    void presetCreationStoresNormalisedRule() throws Exception {
        createPreset();

        mockMvc.perform(get("/api/alerts").param("site_id", String.valueOf(site.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name", is("High Power Draw (> 1500W)")))
                .andExpect(jsonPath("$[0].enabled", is(true)))
                .andExpect(jsonPath("$[0].rule_json.type", is("threshold")))
                .andExpect(jsonPath("$[0].rule_json.key", is("power")))
                .andExpect(jsonPath("$[0].rule_json.op", is("gt")))
                .andExpect(jsonPath("$[0].rule_json.duration_sec", is(120)))
                .andExpect(jsonPath("$[0].created_at", startsWith("2026-03-01T12:00")));
    }

    @Test
    void customRuleIsValidated() throws Exception {
        String valid = "{\"site_id\":" + site.getId() + ",\"name\":\"Too cold\",\"rule_json\":{\"type\":\"threshold\",\"device_ids\":["
                + meter.getId() + "],\"key\":\"temp\",\"op\":\"lt\",\"value\":5}}";
        mockMvc.perform(post("/api/alerts").contentType(MediaType.APPLICATION_JSON).content(valid))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name", is("Too cold")))
                .andExpect(jsonPath("$.rule_json.duration_sec", is(0)));

        String invalid = "{\"site_id\":" + site.getId() + ",\"name\":\"Broken\",\"rule_json\":{\"type\":\"threshold\",\"device_ids\":[1]}}";
        mockMvc.perform(post("/api/alerts").contentType(MediaType.APPLICATION_JSON).content(invalid))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.message", containsString("key")));

        String unknownPreset = "{\"site_id\":" + site.getId() + ",\"preset_type\":\"meltdown\",\"device_ids\":[1]}";
        mockMvc.perform(post("/api/alerts").contentType(MediaType.APPLICATION_JSON).content(unknownPreset))
                .andExpect(status().isBadRequest());
    }

    @Test
    void snoozeReturnsDeadline() throws Exception {
        long id = createPreset();

        mockMvc.perform(post("/api/alerts/{id}/snooze", id).contentType(MediaType.APPLICATION_JSON).content("{\"minutes\":45}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.snoozed_until", startsWith("2026-03-01T12:45")));

        mockMvc.perform(post("/api/alerts/{id}/snooze", id + 999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success", is(false)));
    }

    @Test
    void testFiringShowsUpInHistory() throws Exception {
        long id = createPreset();

        mockMvc.perform(post("/api/alerts/{id}/test", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fired_alert_ids", contains((int) id)));

        mockMvc.perform(get("/api/alert-events").param("alert_id", String.valueOf(id)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].alert_id", is((int) id)))
                .andExpect(jsonPath("$[0].payload.type", is("test")))
                .andExpect(jsonPath("$[0].payload.message", is("This is a test alert")));
    }

    @Test
    void testFiringUnknownAlertExplainsNotFound() throws Exception {
        long id = createPreset();

        mockMvc.perform(post("/api/alerts/{id}/test", id + 999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.message", is("Alert not found")));
        assertEquals(0, alertEventRepository.count());
    }

    @Test
    void manualEvaluationReportsPass() throws Exception {
        createPreset();

        mockMvc.perform(post("/api/alerts/evaluate").param("site_id", String.valueOf(site.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.site_id", is(site.getId().intValue())))
                .andExpect(jsonPath("$.rules_evaluated", is(1)))
                .andExpect(jsonPath("$.fired_alert_ids", hasSize(0)));
    }
}
