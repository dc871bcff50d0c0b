package com.sandy.aiot.vision.sentinel.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

@Entity
@Table(name = "devices")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Device {
    public static final String CAP_REALTIME = "realtime";
    public static final String CAP_HISTORICAL = "historical";
    public static final String CAP_ALARMS = "alarms";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(nullable = false)
    private Long siteId;
    private String name;
    /** Primary metric key of the device: power, voltage, current, temp, humidity ... */
    @Column(length = 32)
    private String type;
    @Column(length = 16)
    private String unit; // W, V, A, °C, %
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "device_capabilities", joinColumns = @JoinColumn(name = "device_id"))
    @Column(name = "capability", length = 32)
    @Builder.Default
    private Set<String> capabilities = new HashSet<>();
    private LocalDateTime lastSeenAt;
    @Builder.Default
    private boolean active = true;

    public boolean hasCapability(String capability) {
        return capabilities != null && capabilities.contains(capability);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Device device = (Device) o;
        return Objects.equals(id, device.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }
}
