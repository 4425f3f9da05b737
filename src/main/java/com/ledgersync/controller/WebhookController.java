package com.ledgersync.controller;

import com.ledgersync.service.WebhookAction;
import com.ledgersync.service.WebhookService;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Always answers 200 so the aggregator does not keep retrying a payload that will never be
 * accepted. Rejections are visible in the logs only.
 */
@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {
  private final WebhookService webhookService;

  public WebhookController(WebhookService webhookService) {
    this.webhookService = webhookService;
  }

  @PostMapping("/plaid")
  public Map<String, Boolean> receive(@RequestHeader HttpHeaders headers,
                                      @RequestBody(required = false) String body) {
    WebhookAction action = webhookService.receive(headers, body == null ? "" : body);
    return Map.of("received", action != WebhookAction.REJECTED);
  }
}
