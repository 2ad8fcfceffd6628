package tech.yump.ledger.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.ledger.core.Ledger;

import java.util.Map;

@RestController
@Tag(name = "System", description = "System information endpoints")
public class RootController {

  private final Ledger complianceLedger;

  public RootController(Ledger complianceLedger) {
    this.complianceLedger = complianceLedger;
  }

  @GetMapping("/")
  @Operation(
          summary = "Root Endpoint",
          description = "Welcome message and whether the ledger persists events. Does not require authentication.",
          security = {}
  )
  @ApiResponse(responseCode = "200", description = "Welcome message and status.",
          content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE,
                  schema = @Schema(type = "object", example = "{\"message\": \"Welcome to Lite Ledger API\", \"status\": \"OK\", \"ledger_enabled\": true}")))
  public Map<String, Object> getRoot() {
    return Map.of(
            "message", "Welcome to Lite Ledger API",
            "status", "OK",
            "ledger_enabled", complianceLedger.isEnabled());
  }
}
