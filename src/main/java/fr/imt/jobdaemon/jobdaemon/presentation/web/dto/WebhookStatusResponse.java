package fr.imt.jobdaemon.jobdaemon.presentation.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WebhookStatusResponse {
    private boolean enabled;
    private List<String> endpoints;
}
