package lab.relay.auth;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.crypto.Hash;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Role lookups against an OpenZeppelin-style AccessControl contract.
 * A role name such as {@code ADMIN} maps to the role id {@code keccak256("ADMIN_ROLE")}.
 */
@Component
@ConditionalOnProperty(prefix = "relay.auth", name = "registry", havingValue = "contract")
public class ContractRoleRegistry implements RoleRegistry {

    private final Web3j web3j;
    private final String roleContract;

    public ContractRoleRegistry(Web3j web3j, RoleMembershipProperties properties) {
        if (properties.getRoleContract() == null || properties.getRoleContract().isBlank()) {
            throw new IllegalStateException("relay.auth.role-contract must be configured when relay.auth.registry=contract");
        }
        this.web3j = web3j;
        this.roleContract = properties.getRoleContract().trim();
    }

    @Override
    public boolean hasRole(String identity, String role) {
        Function hasRole = new Function(
                "hasRole",
                List.of(new Bytes32(roleId(role)), new Address(identity)),
                List.of(new TypeReference<Bool>() {})
        );
        try {
            EthCall response = web3j.ethCall(
                    Transaction.createEthCallTransaction(null, roleContract, FunctionEncoder.encode(hasRole)),
                    DefaultBlockParameterName.LATEST
            ).send();
            if (response.hasError()) {
                throw new IllegalStateException("hasRole call failed: " + response.getError().getMessage());
            }
            List<Type> decoded = FunctionReturnDecoder.decode(response.getValue(), hasRole.getOutputParameters());
            return !decoded.isEmpty() && Boolean.TRUE.equals(decoded.get(0).getValue());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to query role registry", e);
        }
    }

    static byte[] roleId(String role) {
        return Numeric.hexStringToByteArray(Hash.sha3String(role.trim().toUpperCase(Locale.ROOT) + "_ROLE"));
    }
}
