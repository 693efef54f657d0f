package uk.gegc.coursemaker.features.billing.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.coursemaker.features.billing.application.StripeWebhookService;
import uk.gegc.coursemaker.shared.config.FeatureFlags;

@Slf4j
@RestController
@RequestMapping("/api/v1/billing")
@RequiredArgsConstructor
@Tag(name = "Stripe Webhooks", description = "Internal endpoint for Stripe webhook events (not for public use)")
public class StripeWebhookController {

    private final StripeWebhookService webhookService;
    private final FeatureFlags featureFlags;

    @Operation(
            summary = "Handle Stripe webhook",
            description = "Internal endpoint for Stripe checkout events. Validates the signature before anything is changed."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Webhook processed, duplicate or ignored"),
            @ApiResponse(responseCode = "400", description = "Invalid signature",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Billing feature disabled",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden
    @PostMapping("/stripe/webhook")
    public ResponseEntity<String> handleStripeWebhook(
            @Parameter(hidden = true) @RequestBody String payload,
            @Parameter(description = "Stripe signature header for verification")
            @RequestHeader(name = "Stripe-Signature", required = false) String sigHeader
    ) {
        if (!featureFlags.isBilling()) {
            log.warn("Billing feature is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("");
        }

        var res = webhookService.process(payload, sigHeader);
        return ResponseEntity.ok(switch (res) {
            case OK, DUPLICATE, IGNORED -> "";
        });
    }
}
