package com.walletfeed.repository;

import com.walletfeed.model.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {
    Page<Notification> findByRecipientIdOrderByCreatedAtDescIdDesc(Long recipientId, Pageable pageable);

    List<Notification> findByIdIn(Collection<Long> ids);

    long countByRecipientIdAndViewedFalse(Long recipientId);

    @Modifying
    @Query("UPDATE Notification n SET n.viewed = true WHERE n.recipient.id = :recipientId AND n.id IN :ids")
    int markViewed(@Param("recipientId") Long recipientId, @Param("ids") Collection<Long> ids);
}
