package lab.relay.domain.transfer;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "transfer_requests",
       indexes = {
           @Index(name = "idx_transfer_source", columnList = "sourceIdentity"),
           @Index(name = "idx_transfer_tx_handle", columnList = "txHandle")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class TransferRequest {

    @Id
    private UUID id;

    @Column(nullable = false, updatable = false, length = 128)
    private String sourceIdentity;

    @Column(nullable = false, updatable = false, length = 128)
    private String destinationIdentity;

    @Column(nullable = false, updatable = false, length = 32)
    private String destinationChain;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private PayloadKind payloadKind;

    @Lob
    @Column(nullable = false, updatable = false)
    private byte[] payload;

    @Column(nullable = false, updatable = false)
    private long maxFeeWei;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TransferState state;

    @Column(nullable = false)
    private int attempts;

    @Column(length = 500)
    private String lastError;

    @Column(length = 80)
    private String txHandle; // set once the chain accepted the submission

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    public static TransferRequest pending(
            UUID id,
            String sourceIdentity,
            String destinationIdentity,
            String destinationChain,
            PayloadKind payloadKind,
            byte[] payload,
            long maxFeeWei,
            Instant now) {
        return TransferRequest.builder()
                .id(id)
                .sourceIdentity(sourceIdentity)
                .destinationIdentity(destinationIdentity)
                .destinationChain(destinationChain)
                .payloadKind(payloadKind)
                .payload(payload.clone())
                .maxFeeWei(maxFeeWei)
                .state(TransferState.PENDING)
                .attempts(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void transitionTo(TransferState next, Instant now) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("invalid transfer state transition: " + state + " -> " + next);
        }
        this.state = next;
        this.updatedAt = now;
    }

    public void recordAttempt(Instant now) {
        this.attempts++;
        this.updatedAt = now;
    }

    public void recordError(String error, Instant now) {
        this.lastError = truncate(error);
        this.updatedAt = now;
    }

    public void markAccepted(String txHandle, Instant now) {
        this.txHandle = txHandle;
        transitionTo(TransferState.AWAITING_CONFIRMATION, now);
    }

    public void markFailed(String error, Instant now) {
        recordError(error, now);
        transitionTo(TransferState.FAILED, now);
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() <= 500 ? error : error.substring(0, 500);
    }
}
