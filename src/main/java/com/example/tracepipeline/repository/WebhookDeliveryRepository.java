package com.example.tracepipeline.repository;

import com.example.tracepipeline.model.WebhookDelivery;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WebhookDeliveryRepository extends JpaRepository<WebhookDelivery, String> {

    List<WebhookDelivery> findByWebhookIdOrderByCreatedAtDesc(String webhookId);
}
