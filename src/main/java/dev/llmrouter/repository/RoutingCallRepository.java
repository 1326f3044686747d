package dev.llmrouter.repository;

import dev.llmrouter.domain.entity.RoutingCall;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface RoutingCallRepository extends JpaRepository<RoutingCall, UUID> {
}
