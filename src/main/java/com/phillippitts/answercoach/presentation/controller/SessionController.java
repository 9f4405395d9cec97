package com.phillippitts.answercoach.presentation.controller;

import com.phillippitts.answercoach.domain.Bullet;
import com.phillippitts.answercoach.domain.QuestionDefinition;
import com.phillippitts.answercoach.exception.ConfigurationException;
import com.phillippitts.answercoach.presentation.controller.SessionDtos.CreateSessionRequest;
import com.phillippitts.answercoach.presentation.controller.SessionDtos.FollowupResponse;
import com.phillippitts.answercoach.presentation.controller.SessionDtos.FragmentRequest;
import com.phillippitts.answercoach.presentation.controller.SessionDtos.FragmentResponse;
import com.phillippitts.answercoach.presentation.controller.SessionDtos.ReportResponse;
import com.phillippitts.answercoach.presentation.controller.SessionDtos.SessionResponse;
import com.phillippitts.answercoach.service.engine.CoverageSession;
import com.phillippitts.answercoach.service.session.CoverageSessionService;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.List;
import java.util.UUID;

/**
 * Session API: create a session, stream fragments into it, inspect it, finalize it.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private static final Logger LOG = LogManager.getLogger(SessionController.class);

    private final CoverageSessionService sessions;

    SessionController(CoverageSessionService sessions) {
        this.sessions = sessions;
    }

    @PostMapping
    ResponseEntity<SessionResponse> create(@Valid @RequestBody CreateSessionRequest request) {
        boolean hasBullets = request.bullets() != null && !request.bullets().isEmpty();
        boolean hasModelAnswer = request.modelAnswer() != null && !request.modelAnswer().isBlank();
        if (hasBullets && hasModelAnswer) {
            throw new ConfigurationException("bullets", "provide either bullets or modelAnswer, not both");
        }

        CoverageSession session;
        if (hasModelAnswer) {
            session = sessions.createFromModelAnswer(request.questionId(), request.questionText(), request.tags(),
                    request.subtags(), request.modelAnswer());
        } else {
            List<Bullet> bullets = hasBullets
                    ? request.bullets().stream().map(b -> new Bullet(b.id(), b.text())).toList()
                    : List.of();
            session = sessions.create(new QuestionDefinition(request.questionId(), request.questionText(),
                    request.tags(), request.subtags(), bullets));
        }
        LOG.info("Session {} started via API for question {}", session.getId(), request.questionId());
        return ResponseEntity.created(URI.create("/api/sessions/" + session.getId()))
                .body(SessionResponse.from(session.snapshot()));
    }

    @PostMapping("/{id}/fragments")
    ResponseEntity<FragmentResponse> submit(@PathVariable("id") UUID id, @Valid @RequestBody FragmentRequest request) {
        FragmentResponse body = FragmentResponse.from(
                sessions.submit(id, request.sequenceIndex(), request.text()).orElse(null));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/{id}")
    ResponseEntity<SessionResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(SessionResponse.from(sessions.snapshot(id)));
    }

    @GetMapping("/{id}/followups")
    ResponseEntity<List<FollowupResponse>> followups(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(FollowupResponse.fromAll(sessions.followups(id)));
    }

    @PostMapping("/{id}/finalize")
    ResponseEntity<ReportResponse> finalizeSession(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ReportResponse.from(sessions.finalizeSession(id)));
    }
}
