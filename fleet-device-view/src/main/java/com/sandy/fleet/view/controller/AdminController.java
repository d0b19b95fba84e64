package com.sandy.fleet.view.controller;

import com.sandy.fleet.view.model.CompactChangesResponse;
import com.sandy.fleet.view.model.ModelInfo;
import com.sandy.fleet.view.model.RollbackResponse;
import com.sandy.fleet.view.service.ConfigAdminService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Administrative actions. Results are returned to the caller only; the device registry is untouched.
 */
@Controller
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final ConfigAdminService configAdminService;

    @PostMapping(value = "/rollback/{changeName}", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public CompletableFuture<RollbackResponse> rollback(@PathVariable String changeName,
                                                        @RequestParam(value = "comment", required = false) String comment) {
        return configAdminService.requestRollback(changeName, comment).subscribeAsCompletionStage();
    }

    @PostMapping(value = "/compact", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public CompletableFuture<CompactChangesResponse> compact(@RequestParam("retentionSeconds") long retentionSeconds) {
        return configAdminService.requestCompactChanges(retentionSeconds).subscribeAsCompletionStage();
    }

    @GetMapping(value = "/models", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public CompletableFuture<List<ModelInfo>> models() {
        return configAdminService.requestListRegisteredModels().collect().asList().subscribeAsCompletionStage();
    }
}
