package com.sandy.aiot.vision.sentinel.controller;

import com.sandy.aiot.vision.sentinel.entity.Site;
import com.sandy.aiot.vision.sentinel.repository.SiteRepository;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;

@RestController
@RequestMapping("/api/sites")
@RequiredArgsConstructor
@Slf4j
public class SiteController {

    private final SiteRepository siteRepository;

    @GetMapping
    public List<Site> list() {
        return siteRepository.findAll(Sort.by("id"));
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody CreateReq req) {
        if (req.getName() == null || req.getName().isBlank()) {
            return ResponseEntity.badRequest().body(ActionResp.fail("name is required"));
        }
        String tz = req.getTz() == null || req.getTz().isBlank() ? "UTC" : req.getTz().trim();
        try {
            ZoneId.of(tz);
        } catch (DateTimeException e) {
            return ResponseEntity.badRequest().body(ActionResp.fail("Unknown time zone: " + tz));
        }
        Site site = siteRepository.save(Site.builder().name(req.getName().trim()).tz(tz).build());
        log.info("Created site id={} name={} tz={}", site.getId(), site.getName(), site.getTz());
        return ResponseEntity.status(HttpStatus.CREATED).body(site);
    }

    @Data
    public static class CreateReq {
        private String name;
        private String tz;
    }
}
