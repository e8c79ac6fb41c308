package com.bank.behaviorauth.controller;

import com.bank.behaviorauth.model.LearningStatistics;
import com.bank.behaviorauth.model.ProfileStatus;
import com.bank.behaviorauth.service.ProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/profiles")
@Tag(name = "Profiles", description = "Learning status of users' behavioral profiles")
public class ProfileController {

    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @Operation(summary = "Get learning phase statistics",
            description = "User counts per learning phase, derived from the live phase state.")
    @GetMapping("/statistics")
    public ResponseEntity<LearningStatistics> getStatistics() {
        return ResponseEntity.ok(profileService.getStatistics());
    }

    @Operation(summary = "Get a user's learning status",
            description = "Returns the phase, sessions analyzed and still needed, stored vectors, drift " +
                    "baseline state and recent failures. Unknown users are reported as new (cold_start).")
    @GetMapping("/{userId}")
    public ResponseEntity<ProfileStatus> getProfile(
            @Parameter(description = "User ID", example = "USER-001")
            @PathVariable String userId) {
        return ResponseEntity.ok(profileService.getStatus(userId));
    }

    @Operation(summary = "Reset a user's profile",
            description = "Drops stored vectors, drift baseline, failures and phase; the user restarts in cold_start.")
    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> resetProfile(
            @Parameter(description = "User ID", example = "USER-001")
            @PathVariable String userId) {
        profileService.resetProfile(userId);
        return ResponseEntity.noContent().build();
    }
}
