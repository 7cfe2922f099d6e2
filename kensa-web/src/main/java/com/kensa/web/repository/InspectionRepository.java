package com.kensa.web.repository;

import com.kensa.web.entity.InspectionEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface InspectionRepository extends CrudRepository<InspectionEntity, Long> {

    Optional<InspectionEntity> findByInspectionId(String inspectionId);

    @Query("SELECT * FROM t_inspection ORDER BY id DESC LIMIT 20")
    List<InspectionEntity> findRecent();

    /** 某批次的不合格件数 */
    @Query("SELECT COUNT(*) FROM t_inspection WHERE batch = :batch AND status = 'FAIL'")
    long countFailuresInBatch(String batch);
}
