package lab.relay.domain.transfer;

public enum PayloadKind {
    MESSAGE,
    ASSET
}
