package com.example.studio.roster.controller;

import com.example.studio.common.util.StringSanitizer;
import com.example.studio.permission.Action;
import com.example.studio.roster.document.LessonDoc;
import com.example.studio.roster.dto.PageParams;
import com.example.studio.roster.dto.PagedResponse;
import com.example.studio.roster.service.ScopedQueryService;
import com.example.studio.scope.model.ScopedResource;
import com.example.studio.security.annotation.RequiresPermission;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.example.studio.common.util.StringSanitizer.SAFE_ID_REGEX;

@Slf4j
@RestController
@RequestMapping("/api/lessons")
@Validated
@RequiredArgsConstructor
public class LessonController {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "scheduledStart");

    private final ScopedQueryService queryService;

    @RequiresPermission(resource = ScopedResource.LESSONS, action = Action.VIEW)
    @GetMapping
    public Mono<PagedResponse<LessonDoc>> listLessons(
            @RequestParam(required = false) @Pattern(regexp = SAFE_ID_REGEX) String teacherId,
            @RequestParam(required = false) @Pattern(regexp = SAFE_ID_REGEX) String studentId,
            @RequestParam(required = false) @Pattern(regexp = SAFE_ID_REGEX) String status,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(required = false) Integer page,
            @RequestParam(name = "perPage", required = false) Integer perPage) {

        List<Criteria> filters = new ArrayList<>();
        if (teacherId != null) {
            filters.add(Criteria.where("teacherId").is(teacherId));
        }
        if (studentId != null) {
            filters.add(Criteria.where("studentId").is(studentId));
        }
        if (status != null) {
            filters.add(Criteria.where("status").is(status));
        }
        if (from != null || to != null) {
            Criteria window = Criteria.where("scheduledStart");
            if (from != null) {
                window = window.gte(from);
            }
            if (to != null) {
                window = window.lte(to);
            }
            filters.add(window);
        }

        return queryService.findPage(
                ScopedResource.LESSONS, LessonDoc.class, filters, PageParams.of(page, perPage), NEWEST_FIRST);
    }

    @RequiresPermission(resource = ScopedResource.LESSONS, action = Action.VIEW)
    @GetMapping("/{id}")
    public Mono<LessonDoc> getLesson(@PathVariable @Pattern(regexp = SAFE_ID_REGEX) String id) {
        log.debug("Getting lesson {}", StringSanitizer.forLog(id));

        return queryService.findById(ScopedResource.LESSONS, LessonDoc.class, id)
                .switchIfEmpty(Mono.error(() ->
                        new ResponseStatusException(HttpStatus.NOT_FOUND, "Lesson not found")));
    }
}
