package dev.postify.repository;

import dev.postify.entity.Watermark;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WatermarkRepository extends JpaRepository<Watermark, String> {
}
