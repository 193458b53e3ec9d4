package com.itguru.controller;

import com.itguru.api.dto.ModelSelection;
import com.itguru.api.dto.SessionView;
import com.itguru.session.SessionContext;
import com.itguru.session.SessionRegistry;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionRegistry sessions;

    @Operation(summary = "Last routing decision, sources, follow-ups and errors of a session")
    @GetMapping("/{id}")
    public SessionView get(@PathVariable("id") String id) {
        return require(id).view();
    }

    @Operation(summary = "Select the completion model for a session")
    @PutMapping("/{id}/model")
    public SessionView selectModel(@PathVariable("id") String id, @Valid @RequestBody ModelSelection body) {
        SessionContext session = sessions.getOrCreate(id);
        session.selectModel(body.model().strip());
        log.debug("[session] {} selected model {}", session.id(), session.selectedModel());
        return session.view();
    }

    private SessionContext require(String id) {
        return sessions.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "unknown session: " + id));
    }
}
