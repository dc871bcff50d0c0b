package com.sandy.aiot.vision.sentinel.controller;

import com.sandy.aiot.vision.sentinel.entity.Device;
import com.sandy.aiot.vision.sentinel.repository.DeviceRepository;
import com.sandy.aiot.vision.sentinel.repository.SiteRepository;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Device registry. Only devices with the historical or realtime capability are scanned by the detector.
 */
@RestController
@RequestMapping("/api/devices")
@RequiredArgsConstructor
@Slf4j
public class DeviceController {

    private final DeviceRepository deviceRepository;
    private final SiteRepository siteRepository;

    @GetMapping
    public List<Device> list(@RequestParam(value = "site_id", required = false) Long siteId,
                             @RequestParam(value = "type", required = false) String type,
                             @RequestParam(value = "active", defaultValue = "true") boolean active) {
        List<Device> devices;
        if (siteId != null) {
            devices = active
                    ? deviceRepository.findBySiteIdAndActiveTrueOrderByIdAsc(siteId)
                    : deviceRepository.findBySiteIdOrderByIdAsc(siteId);
        } else {
            devices = deviceRepository.findAll(Sort.by("id")).stream()
                    .filter(d -> !active || d.isActive())
                    .collect(Collectors.toList());
        }
        if (type == null || type.isBlank()) {
            return devices;
        }
        return devices.stream().filter(d -> type.equals(d.getType())).collect(Collectors.toList());
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody CreateReq req) {
        if (req.getSiteId() == null || !siteRepository.existsById(req.getSiteId())) {
            return ResponseEntity.badRequest().body(ActionResp.fail("Unknown site: " + req.getSiteId()));
        }
        if (req.getName() == null || req.getName().isBlank() || req.getType() == null || req.getType().isBlank()) {
            return ResponseEntity.badRequest().body(ActionResp.fail("name and type are required"));
        }
        Set<String> capabilities = req.getCapabilities() == null || req.getCapabilities().isEmpty()
                ? new HashSet<>(Set.of(Device.CAP_REALTIME))
                : new HashSet<>(req.getCapabilities());
        Device device = deviceRepository.save(Device.builder()
                .siteId(req.getSiteId())
                .name(req.getName().trim())
                .type(req.getType().trim())
                .unit(req.getUnit())
                .capabilities(capabilities)
                .build());
        log.info("Created device id={} siteId={} type={} capabilities={}", device.getId(), device.getSiteId(),
                device.getType(), device.getCapabilities());
        return ResponseEntity.status(HttpStatus.CREATED).body(device);
    }

    @Data
    public static class CreateReq {
        private Long siteId;
        private String name;
        private String type;
        private String unit;
        private List<String> capabilities;
    }
}
