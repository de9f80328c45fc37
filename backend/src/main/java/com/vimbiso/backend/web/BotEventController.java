package com.vimbiso.backend.web;

import com.vimbiso.backend.messaging.FlowDispatcher;
import com.vimbiso.backend.messaging.api.OutboundMessage;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Receives events already normalized by a channel adapter and returns the reply to render. */
@RestController
@RequestMapping("/api/bot")
@ConditionalOnProperty(
    prefix = "app.bot.webhook",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class BotEventController {

  private static final Logger log = LoggerFactory.getLogger(BotEventController.class);

  private final FlowDispatcher dispatcher;

  public BotEventController(FlowDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @PostMapping(
      path = "/events",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<OutboundMessage> handle(@Valid @RequestBody InboundEventRequest request) {
    log.debug(
        "bot_event_received channelType={} kind={}", request.channelType(), request.messageKind());
    OutboundMessage reply = dispatcher.handle(request.channel(), request.toEvent());
    return ResponseEntity.ok(reply);
  }
}
