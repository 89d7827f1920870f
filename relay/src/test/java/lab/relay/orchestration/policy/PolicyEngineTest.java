package lab.relay.orchestration.policy;

import lab.relay.adapter.DestinationChains;
import lab.relay.domain.transfer.PayloadKind;
import lab.relay.orchestration.CreateTransferRequest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyEngineTest {

    private static final String OWNER = "0x1111111111111111111111111111111111111111";
    private static final String RECIPIENT = "0x2222222222222222222222222222222222222222";

    private final PolicyEngine engine = engine("");

    @Test
    void wellFormedMessageIsAllowed() {
        assertThat(engine.evaluate(message(RECIPIENT, "polygon", "0.01")).allowed()).isTrue();
    }

    @Test
    void missingFieldsAreNamed() {
        PolicyDecision decision = engine.evaluate(new CreateTransferRequest(
                null, "0xA", RECIPIENT, "polygon", PayloadKind.MESSAGE, "hi", null, null));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo("MISSING_FIELD: maxFee");
        assertThat(decision.rule()).isEqualTo("RequiredFieldsPolicyRule");
    }

    @Test
    void feeMustBePositiveAndWeiRepresentable() {
        assertThat(engine.evaluate(message(RECIPIENT, "polygon", "0")).reason()).startsWith("INVALID_FEE");
        assertThat(engine.evaluate(message(RECIPIENT, "polygon", "0.0000000000000000001")).reason()).startsWith("INVALID_FEE");
        assertThat(engine.evaluate(message(RECIPIENT, "polygon", "0.06")).reason()).startsWith("FEE_CEILING_EXCEEDED");
        assertThat(engine.evaluate(message(RECIPIENT, "polygon", "0.05")).allowed()).isTrue();
    }

    @Test
    void firstRejectionWins() {
        PolicyDecision decision = engine.evaluate(message("bogus", "solana", "9"));

        assertThat(decision.reason()).startsWith("INVALID_RECIPIENT");
    }

    @Test
    void assetTransfersNeedPositiveTokenAndAddressOwner() {
        assertThat(engine.evaluate(asset(OWNER, BigInteger.ZERO)).reason()).startsWith("INVALID_PAYLOAD: tokenId");
        assertThat(engine.evaluate(asset("0xA", BigInteger.ONE)).reason()).startsWith("INVALID_PAYLOAD: asset owner");
        assertThat(engine.evaluate(asset(OWNER, BigInteger.ONE)).allowed()).isTrue();
    }

    @Test
    void emptyMessageIsRejected() {
        PolicyDecision decision = engine.evaluate(new CreateTransferRequest(
                null, "0xA", RECIPIENT, "polygon", PayloadKind.MESSAGE, "", null, new BigDecimal("0.01")));

        assertThat(decision.reason()).isEqualTo("INVALID_PAYLOAD: message is required");
    }

    @Test
    void whitelistIsCaseInsensitiveWhenConfigured() {
        PolicyEngine whitelisted = engine(" 0xABCDEFabcdefABCDEFabcdefABCDEFabcdefABCD ");
        String other = "0x3333333333333333333333333333333333333333";

        assertThat(whitelisted.evaluate(message("0xabcdefabcdefabcdefabcdefabcdefabcdefabcd", "polygon", "0.01")).allowed()).isTrue();
        assertThat(whitelisted.evaluate(message(other, "polygon", "0.01")).reason()).startsWith("RECIPIENT_NOT_WHITELISTED");
    }

    private static PolicyEngine engine(String whitelist) {
        return new PolicyEngine(List.of(
                new RequiredFieldsPolicyRule(),
                new RecipientAddressPolicyRule(),
                new DestinationChainPolicyRule(new DestinationChains("ethereum:101,polygon:109")),
                new FeeCeilingPolicyRule(new BigDecimal("0.05")),
                new PayloadPolicyRule(64),
                new RecipientWhitelistPolicyRule(whitelist)
        ));
    }

    private static CreateTransferRequest message(String to, String chain, String fee) {
        return new CreateTransferRequest(null, "0xA", to, chain, PayloadKind.MESSAGE, "hello", null, new BigDecimal(fee));
    }

    private static CreateTransferRequest asset(String owner, BigInteger tokenId) {
        return new CreateTransferRequest(null, owner, RECIPIENT, "ethereum", PayloadKind.ASSET, null, tokenId, new BigDecimal("0.01"));
    }
}
