package com.sandy.aiot.vision.sentinel.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "sites")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Site {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(nullable = false, length = 128)
    private String name;
    /** IANA zone id used as the wall-clock for alert schedules, e.g. "America/Toronto". */
    @Column(length = 64)
    @Builder.Default
    private String tz = "UTC";
}
