package io.mersel.services.testcase.web.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Not ekleme isteği DTO'su.
 */
public class NoteRequestDto {

    @NotBlank(message = "Not metni boş olamaz")
    @Size(max = 10000)
    @Schema(description = "Not metni (baştaki/sondaki boşluklar kırpılır)",
            example = "Beleg wurde korrekt gedruckt",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String text;

    @Size(max = 200)
    @Schema(description = "Notu yazan kişi", example = "Tester", nullable = true)
    private String author;

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }
}
