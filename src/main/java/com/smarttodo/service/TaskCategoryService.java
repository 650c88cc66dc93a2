package com.smarttodo.service;

import com.smarttodo.dto.CategoryStatDTO;
import com.smarttodo.entity.TaskCategory;
import com.smarttodo.repository.TaskCategoryRepository;
import com.smarttodo.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Categories are global and created lazily by name.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskCategoryService {

    private static final int POPULAR_LIMIT = 10;

    private final TaskCategoryRepository categoryRepository;
    private final TaskRepository taskRepository;

    /**
     * @return the category with this (trimmed) name, creating it if needed; empty for a blank name
     *         or one longer than {@link TaskCategory#NAME_MAX_LENGTH}
     */
    @Transactional
    public Optional<TaskCategory> getOrCreate(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.strip();
        if (trimmed.length() > TaskCategory.NAME_MAX_LENGTH) {
            log.warn("Ignoring category name of {} characters (limit {})", trimmed.length(),
                    TaskCategory.NAME_MAX_LENGTH);
            return Optional.empty();
        }
        return Optional.of(categoryRepository.findByName(trimmed).orElseGet(() -> {
            log.info("Creating category '{}'", trimmed);
            return categoryRepository.save(new TaskCategory(trimmed));
        }));
    }

    @Transactional
    public Set<TaskCategory> getOrCreateAll(Collection<String> names) {
        Set<TaskCategory> categories = new LinkedHashSet<>();
        for (String name : names) {
            getOrCreate(name).ifPresent(categories::add);
        }
        return categories;
    }

    /**
     * The categories carrying the most tasks across all users, busiest first.
     */
    @Transactional(readOnly = true)
    public List<CategoryStatDTO> popularCategories() {
        return taskRepository.countTopCategories(PageRequest.of(0, POPULAR_LIMIT)).stream()
                .map(row -> new CategoryStatDTO((String) row[0], ((Number) row[1]).longValue()))
                .toList();
    }
}
