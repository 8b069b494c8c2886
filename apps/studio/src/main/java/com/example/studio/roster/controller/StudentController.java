package com.example.studio.roster.controller;

import com.example.studio.permission.Action;
import com.example.studio.roster.document.StudentDoc;
import com.example.studio.roster.dto.PageParams;
import com.example.studio.roster.dto.PagedResponse;
import com.example.studio.roster.service.ScopedQueryService;
import com.example.studio.scope.model.ScopedResource;
import com.example.studio.security.annotation.RequiresPermission;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
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

import java.util.List;

import static com.example.studio.common.util.StringSanitizer.SAFE_ID_REGEX;

@RestController
@Validated
@RequestMapping("/api/students")
@RequiredArgsConstructor
@RequiresPermission(resource = ScopedResource.STUDENTS, action = Action.VIEW)
public class StudentController {

    private static final Sort BY_NAME = Sort.by("lastName", "firstName");

    private final ScopedQueryService queryService;

    @GetMapping
    public Mono<PagedResponse<StudentDoc>> listStudents(
            @RequestParam(required = false) @Pattern(regexp = SAFE_ID_REGEX) String familyId,
            @RequestParam(required = false) Integer page,
            @RequestParam(name = "perPage", required = false) Integer perPage) {

        List<Criteria> filters = familyId == null
                ? List.of()
                : List.of(Criteria.where("familyId").is(familyId));

        return queryService.findPage(
                ScopedResource.STUDENTS, StudentDoc.class, filters, PageParams.of(page, perPage), BY_NAME);
    }

    @GetMapping("/{id}")
    public Mono<StudentDoc> getStudent(@PathVariable @Pattern(regexp = SAFE_ID_REGEX) String id) {
        return queryService.findById(ScopedResource.STUDENTS, StudentDoc.class, id)
                .switchIfEmpty(Mono.error(() ->
                        new ResponseStatusException(HttpStatus.NOT_FOUND, "Student not found")));
    }
}
