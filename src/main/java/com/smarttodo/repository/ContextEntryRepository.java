package com.smarttodo.repository;

import com.smarttodo.entity.ContextEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContextEntryRepository extends JpaRepository<ContextEntry, UUID> {

    // Newest first by the date the entry refers to, then by insertion time
    List<ContextEntry> findByUserIdOrderByEntryDateDescCreatedAtDesc(Long userId, Pageable pageable);

    List<ContextEntry> findByUserIdOrderByCreatedAtDesc(Long userId, Pageable pageable);
}
