package com.fintech.checkout.repository;

import com.fintech.checkout.entity.Notification;
import com.fintech.checkout.entity.NotificationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    List<Notification> findByTypeOrderByCreatedAtDesc(NotificationType type);
}
