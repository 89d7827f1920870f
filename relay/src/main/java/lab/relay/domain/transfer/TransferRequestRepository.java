package lab.relay.domain.transfer;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TransferRequestRepository extends JpaRepository<TransferRequest, UUID> {

    List<TransferRequest> findBySourceIdentityOrderByCreatedAtAsc(String sourceIdentity);
}
