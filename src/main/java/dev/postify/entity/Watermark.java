package dev.postify.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Named progress marker of a polling job, so a restart resumes where the
 * last run stopped.
 */
@Data
@Entity
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "watermarks")
public class Watermark {

    @Id
    @Column(length = 100)
    private String name;

    @Column(nullable = false)
    private LocalDateTime position;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
