package com.openforge.taskcore.repository;

import com.openforge.taskcore.domain.TaskTemplate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface TaskTemplateRepository extends JpaRepository<TaskTemplate, Long> {

    Optional<TaskTemplate> findByTemplateId(String templateId);

    /** Stable ordering so keyword fallback ties always resolve to the same template. */
    List<TaskTemplate> findByEnabledTrueOrderByTemplateIdAsc();

    /**
     * Read-increment-compare in one statement: the row is only touched while it is
     * still under the cap, so concurrent failures can never push it past {@code maxAttempts}.
     *
     * @return 1 if an attempt was consumed, 0 if the budget is exhausted or the template is unknown
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update TaskTemplate t
               set t.repairAttempts = t.repairAttempts + 1,
                   t.version = t.version + 1
             where t.templateId = :templateId
               and t.repairAttempts < :maxAttempts
            """)
    int incrementRepairAttempts(@Param("templateId") String templateId,
                                @Param("maxAttempts") int maxAttempts);
}
