package com.trueform.client;

/**
 * API namespaces of the objects the provider manages. The wire name prefixes
 * the action, e.g. {@code pool.dataset.create}.
 */
public enum ResourceKind {
    POOL("pool"),
    DATASET("pool.dataset"),
    SNAPSHOT("zfs.snapshot"),
    SHARE_SMB("sharing.smb"),
    SHARE_NFS("sharing.nfs"),
    USER("user"),
    VM("vm"),
    VM_DEVICE("vm.device"),
    APP("app"),
    CRONJOB("cronjob"),
    ISCSI_PORTAL("iscsi.portal"),
    ISCSI_TARGET("iscsi.target"),
    ISCSI_EXTENT("iscsi.extent"),
    ISCSI_INITIATOR("iscsi.initiator"),
    ISCSI_TARGET_EXTENT("iscsi.targetextent"),
    CERTIFICATE("certificate"),
    STATIC_ROUTE("staticroute");

    private final String wireName;

    ResourceKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** {@code <wireName>.<action>}. */
    public String method(String action) {
        return wireName + "." + action;
    }

    /**
     * @return the kind with this wire name, or {@code null}
     */
    public static ResourceKind fromWireName(String wireName) {
        for (ResourceKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        return null;
    }
}
