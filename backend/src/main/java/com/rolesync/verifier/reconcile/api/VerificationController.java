package com.rolesync.verifier.reconcile.api;

import com.rolesync.verifier.reconcile.model.CommandReply;
import com.rolesync.verifier.reconcile.model.JobStatusResponse;
import com.rolesync.verifier.reconcile.model.MemberOutcome;
import com.rolesync.verifier.reconcile.service.VerificationCommandService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/guilds/{guildId}")
public class VerificationController {
    private final VerificationCommandService commandService;

    public VerificationController(VerificationCommandService commandService) {
        this.commandService = commandService;
    }

    @PostMapping("/members/{userId}/verify")
    public CommandReply verify(@PathVariable("guildId") String guildId, @PathVariable("userId") String userId) {
        return commandService.verify(guildId, userId);
    }

    @PostMapping("/members/{userId}/joined")
    public ResponseEntity<MemberOutcome> memberJoined(@PathVariable("guildId") String guildId, @PathVariable("userId") String userId) {
        return commandService.memberJoined(guildId, userId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/reverify")
    public CommandReply reverify(
        @PathVariable("guildId") String guildId,
        @RequestParam(name = "initiator", required = false, defaultValue = "api") String initiator
    ) {
        return commandService.reverify(guildId, initiator);
    }

    @PostMapping("/reverify/async")
    public ResponseEntity<JobStatusResponse> startReverify(
        @PathVariable("guildId") String guildId,
        @RequestParam(name = "initiator", required = false, defaultValue = "api") String initiator
    ) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(commandService.startReverify(guildId, initiator));
    }

    @PostMapping("/reverify/cancel")
    public CommandReply cancel(@PathVariable("guildId") String guildId) {
        return commandService.cancel(guildId);
    }

    @GetMapping("/reverify")
    public ResponseEntity<JobStatusResponse> status(@PathVariable("guildId") String guildId) {
        return commandService.status(guildId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
