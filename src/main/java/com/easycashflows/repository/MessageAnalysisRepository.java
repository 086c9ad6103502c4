package com.easycashflows.repository;

import com.easycashflows.domain.enums.AnalysisOutcome;
import com.easycashflows.domain.enums.IntentType;
import com.easycashflows.domain.enums.ReplySource;
import com.easycashflows.domain.model.MessageAnalysis;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface MessageAnalysisRepository extends JpaRepository<MessageAnalysis, UUID> {

    long countByReplySource(ReplySource replySource);

    @Query("select m.intent as intent, count(m) as total from MessageAnalysis m "
            + "where m.analysisOutcome = :outcome group by m.intent order by count(m) desc")
    List<IntentCount> countByIntent(@Param("outcome") AnalysisOutcome outcome, Pageable pageable);

    @Query("select avg(m.confidence) from MessageAnalysis m where m.analysisOutcome = :outcome")
    Double averageConfidence(@Param("outcome") AnalysisOutcome outcome);

    interface IntentCount {
        IntentType getIntent();

        Long getTotal();
    }
}
