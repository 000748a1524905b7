package fr.imt.jobdaemon.jobdaemon.presentation.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class WebhookRequest {
    @NotBlank
    private String endpoint;
}
