package com.cine.explorer.web;

import com.cine.explorer.common.Result;
import com.cine.explorer.common.exception.EntityNotFoundException;
import com.cine.explorer.model.dto.BuildReport;
import com.cine.explorer.service.build.MoviesCompleteBuildService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/build/movies-complete")
@RequiredArgsConstructor
public class BuildController {

    private final MoviesCompleteBuildService buildService;

    /**
     * Blocks until the rebuild finishes.
     */
    @PostMapping
    public ResponseEntity<Result<BuildReport>> build() {
        return ResponseEntity.ok(Result.ok(buildService.build()));
    }

    @PostMapping("/cancel")
    public ResponseEntity<Result<Boolean>> cancel() {
        return ResponseEntity.ok(Result.ok(buildService.cancel()));
    }

    @GetMapping("/last")
    public ResponseEntity<Result<BuildReport>> last() {
        BuildReport report = buildService.lastReport()
                .orElseThrow(() -> new EntityNotFoundException("No movies_complete build has completed yet"));
        return ResponseEntity.ok(Result.ok(report));
    }
}
