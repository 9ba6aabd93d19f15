package com.example.checkin.entities;

import com.example.checkin.enums.SemesterStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/**
 * Semester date range. Week number and break flag are always derived from startDate,
 * so no week column is stored.
 */
@Entity
@Table(name = "semester", indexes = {
        @Index(name = "idx_semester_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Semester {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 120)
    private String name;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SemesterStatus status;
}
