package br.com.coursesync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

// Payload recebido da plataforma externa (formato edX)
public record CourseSyncRequest(
        @NotBlank String title,
        @JsonProperty("course_outline") String courseOutline,
        JsonNode structure // Documento aninhado com "course_structure"
) {
}
