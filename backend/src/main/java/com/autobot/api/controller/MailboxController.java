package com.autobot.api.controller;

import com.autobot.api.dto.ErrorBody;
import com.autobot.api.dto.ForwardRuleDto;
import com.autobot.api.dto.ForwardRulesRequest;
import com.autobot.api.dto.MailboxConfigRequest;
import com.autobot.api.dto.MailboxConfigResponse;
import com.autobot.domain.ForwardRule;
import com.autobot.domain.MailboxConfig;
import com.autobot.mail.store.MailboxConfigService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Mailbox configuration CRUD. Passwords are write-only.
 */
@RestController
@RequestMapping("/api/v1/mailboxes")
@RequiredArgsConstructor
public class MailboxController {

    private final MailboxConfigService mailboxConfigService;

    @GetMapping
    public List<MailboxConfigResponse> list() {
        return mailboxConfigService.findAll().stream()
                .map(MailboxController::toResponse)
                .toList();
    }

    @GetMapping("/{email}")
    public ResponseEntity<MailboxConfigResponse> get(@PathVariable String email) {
        return mailboxConfigService.findByEmail(email.trim())
                .map(c -> ResponseEntity.ok(toResponse(c)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{email}")
    public ResponseEntity<?> put(@PathVariable String email, @Valid @RequestBody MailboxConfigRequest request) {
        String key = email.trim();
        MailboxConfig existing = mailboxConfigService.findByEmail(key).orElse(null);
        String password = request.password() != null ? request.password()
                : existing != null ? existing.getPassword() : null;
        if (password == null || password.isBlank()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PASSWORD", "Password is required"));
        }
        MailboxConfig config = new MailboxConfig();
        config.setPassword(password);
        config.setActive(request.active());
        config.setHost(request.host());
        config.setPort(request.port());
        config.setTls(request.tls());
        config.setForwardRules(request.forwardRules() == null ? null : toRules(request.forwardRules()));
        return ResponseEntity.ok(toResponse(mailboxConfigService.save(key, config)));
    }

    @PutMapping("/{email}/rules")
    public ResponseEntity<MailboxConfigResponse> putRules(@PathVariable String email,
                                                          @Valid @RequestBody ForwardRulesRequest request) {
        return mailboxConfigService.updateRules(email.trim(), toRules(request.forwardRules()))
                .map(c -> ResponseEntity.ok(toResponse(c)))
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{email}")
    public ResponseEntity<Void> delete(@PathVariable String email) {
        return mailboxConfigService.delete(email.trim())
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    private static List<ForwardRule> toRules(List<ForwardRuleDto> rules) {
        return rules.stream()
                .map(r -> new ForwardRule(r.subjectSearch(), r.destinationEmail()))
                .toList();
    }

    private static MailboxConfigResponse toResponse(MailboxConfig c) {
        return new MailboxConfigResponse(
                c.getEmail(),
                c.getActive(),
                c.getHost(),
                c.getPort(),
                c.getTls(),
                c.getForwardRules().stream()
                        .map(r -> new ForwardRuleDto(r.getSubjectSearch(), r.getDestinationEmail()))
                        .toList(),
                c.getUpdatedAt());
    }
}
