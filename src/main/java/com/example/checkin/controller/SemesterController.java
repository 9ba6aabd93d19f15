package com.example.checkin.controller;

import com.example.checkin.service.calendar.SemesterService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/semester")
public class SemesterController {

    private final SemesterService semesterService;

    @GetMapping("/current")
    public ResponseEntity<Map<String, Object>> current() {
        return ResponseEntity.ok(Map.of("success", true,
                "semester", semesterService.describe(semesterService.getActiveSemester())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> byId(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("success", true,
                "semester", semesterService.describe(semesterService.getSemester(id))));
    }
}
