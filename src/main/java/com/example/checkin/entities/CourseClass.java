package com.example.checkin.entities;

import com.example.checkin.enums.ClassType;
import jakarta.persistence.*;
import lombok.*;

import java.time.DayOfWeek;
import java.time.LocalTime;

/**
 * A recurring weekly class meeting. Maintained by roster management, read-only here.
 */
@Entity
@Table(name = "course_class", indexes = {
        @Index(name = "idx_class_lecturer", columnList = "lecturer_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CourseClass {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "class_name", nullable = false, length = 160)
    private String className;

    @Column(name = "course_code", nullable = false, length = 32)
    private String courseCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "class_type", length = 16)
    private ClassType classType;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", nullable = false, length = 16)
    private DayOfWeek dayOfWeek;

    private LocalTime startTime;
    private LocalTime endTime;

    @Builder.Default
    private Integer startWeek = 1;

    @Builder.Default
    private Integer endWeek = 14;

    @Column(name = "lecturer_id", nullable = false)
    private Long lecturerId;
}
