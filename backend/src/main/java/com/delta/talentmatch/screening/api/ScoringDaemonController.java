package com.delta.talentmatch.screening.api;

import com.delta.talentmatch.screening.model.ScoringDaemonStatusResponse;
import com.delta.talentmatch.screening.service.ScoringDaemonService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/screening/daemon")
public class ScoringDaemonController {
    private final ScoringDaemonService daemonService;

    public ScoringDaemonController(ScoringDaemonService daemonService) {
        this.daemonService = daemonService;
    }

    @PostMapping("/start")
    public ScoringDaemonStatusResponse start() {
        daemonService.start();
        return daemonService.getStatus();
    }

    @PostMapping("/stop")
    public ScoringDaemonStatusResponse stop() {
        daemonService.stop();
        return daemonService.getStatus();
    }

    @GetMapping("/status")
    public ScoringDaemonStatusResponse status() {
        return daemonService.getStatus();
    }
}
