package fr.imt.jobdaemon.jobdaemon.presentation.web;

import fr.imt.jobdaemon.jobdaemon.exception.ErrorCodes;
import fr.imt.jobdaemon.jobdaemon.infrastructure.webhook.WebhookNotifier;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.ApiResponse;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.WebhookRequest;
import fr.imt.jobdaemon.jobdaemon.presentation.web.dto.WebhookStatusResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
public class WebhookController {

    private final ObjectProvider<WebhookNotifier> webhookNotifier;

    @GetMapping
    public ResponseEntity<ApiResponse<WebhookStatusResponse>> listWebhooks() {
        WebhookNotifier notifier = webhookNotifier.getIfAvailable();
        WebhookStatusResponse status = notifier == null
                ? new WebhookStatusResponse(false, List.of())
                : new WebhookStatusResponse(true, notifier.endpoints());
        return ResponseEntity.ok(ApiResponse.ok(status));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<WebhookStatusResponse>> addWebhook(@Valid @RequestBody WebhookRequest request) {
        WebhookNotifier notifier = webhookNotifier.getIfAvailable();
        if (notifier == null) {
            return new ResponseEntity<>(ApiResponse.error(ErrorCodes.WEBHOOKS_DISABLED,
                    "Set jobdaemon.events.webhooks.enabled=true to register endpoints"), HttpStatus.CONFLICT);
        }
        notifier.register(request.getEndpoint());
        return new ResponseEntity<>(ApiResponse.ok(new WebhookStatusResponse(true, notifier.endpoints())),
                HttpStatus.CREATED);
    }
}
