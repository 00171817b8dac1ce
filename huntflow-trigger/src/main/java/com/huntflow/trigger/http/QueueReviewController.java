package com.huntflow.trigger.http;

import com.huntflow.api.dto.QueueItemDTO;
import com.huntflow.api.dto.QueueReviewRequestDTO;
import com.huntflow.api.response.Response;
import com.huntflow.trigger.application.command.QueueReviewCommandService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 审核队列 API。
 */
@RestController
@RequestMapping("/api/queue")
public class QueueReviewController {

    private final QueueReviewCommandService queueReviewCommandService;

    public QueueReviewController(QueueReviewCommandService queueReviewCommandService) {
        this.queueReviewCommandService = queueReviewCommandService;
    }

    @GetMapping
    public Response<List<QueueItemDTO>> list(@RequestParam(value = "status", required = false) String status,
                                             @RequestParam(value = "limit", required = false) Integer limit) {
        return Response.success(queueReviewCommandService.list(status, limit));
    }

    @GetMapping("/{id}")
    public Response<QueueItemDTO> get(@PathVariable("id") Long queueItemId) {
        return Response.success(queueReviewCommandService.get(queueItemId));
    }

    @PostMapping("/{id}/approve")
    public Response<QueueItemDTO> approve(@PathVariable("id") Long queueItemId,
                                          @RequestBody(required = false) QueueReviewRequestDTO request) {
        return Response.success(queueReviewCommandService.approve(queueItemId, comment(request)));
    }

    @PostMapping("/{id}/reject")
    public Response<QueueItemDTO> reject(@PathVariable("id") Long queueItemId,
                                         @RequestBody(required = false) QueueReviewRequestDTO request) {
        return Response.success(queueReviewCommandService.reject(queueItemId, comment(request)));
    }

    @PostMapping("/{id}/edit")
    public Response<QueueItemDTO> edit(@PathVariable("id") Long queueItemId,
                                       @RequestBody QueueReviewRequestDTO request) {
        return Response.success(queueReviewCommandService.edit(queueItemId, request.getRuleYaml(), request.getComment()));
    }

    private String comment(QueueReviewRequestDTO request) {
        return request == null ? null : request.getComment();
    }
}
