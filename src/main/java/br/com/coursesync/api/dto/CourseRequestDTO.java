package br.com.coursesync.api.dto;

import jakarta.validation.constraints.NotBlank;

// DTO para registrar um curso antes da primeira sincronização
public record CourseRequestDTO(
        @NotBlank String externalId,
        @NotBlank String name,
        String courseOutline,
        @NotBlank String examinationLevel,
        @NotBlank String academicClass
) {
}
