package com.huntflow.trigger.http;

import com.huntflow.api.dto.ExecutionAttemptDTO;
import com.huntflow.api.dto.RuleDraftDTO;
import com.huntflow.api.dto.WorkflowExecutionDTO;
import com.huntflow.api.dto.WorkflowTriggerRequestDTO;
import com.huntflow.api.response.Response;
import com.huntflow.trigger.application.command.WorkflowCommandService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 工作流执行 API：触发、查询、审计轨迹、取消与重试。
 */
@RestController
@RequestMapping("/api/workflow/executions")
public class WorkflowExecutionController {

    private final WorkflowCommandService workflowCommandService;

    public WorkflowExecutionController(WorkflowCommandService workflowCommandService) {
        this.workflowCommandService = workflowCommandService;
    }

    @PostMapping
    public Response<WorkflowExecutionDTO> trigger(@RequestBody WorkflowTriggerRequestDTO request) {
        return Response.success(workflowCommandService.trigger(request == null ? null : request.getDocumentId()));
    }

    @GetMapping("/{id}")
    public Response<WorkflowExecutionDTO> get(@PathVariable("id") Long executionId) {
        return Response.success(workflowCommandService.get(executionId));
    }

    @GetMapping
    public Response<List<WorkflowExecutionDTO>> list(@RequestParam(value = "status", required = false) String status,
                                                     @RequestParam(value = "limit", required = false) Integer limit) {
        return Response.success(workflowCommandService.list(status, limit));
    }

    @GetMapping("/{id}/attempts")
    public Response<List<ExecutionAttemptDTO>> attempts(@PathVariable("id") Long executionId) {
        return Response.success(workflowCommandService.attempts(executionId));
    }

    @GetMapping("/{id}/drafts")
    public Response<List<RuleDraftDTO>> drafts(@PathVariable("id") Long executionId) {
        return Response.success(workflowCommandService.drafts(executionId));
    }

    @PostMapping("/{id}/cancel")
    public Response<WorkflowExecutionDTO> cancel(@PathVariable("id") Long executionId) {
        return Response.success(workflowCommandService.cancel(executionId));
    }

    @PostMapping("/{id}/retry")
    public Response<WorkflowExecutionDTO> retry(@PathVariable("id") Long executionId) {
        return Response.success(workflowCommandService.retry(executionId));
    }
}
