package com.trueform.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResourceKindTest {

    @Test
    void methodNames() {
        assertEquals("pool.dataset.create", ResourceKind.DATASET.method("create"));
        assertEquals("zfs.snapshot.delete", ResourceKind.SNAPSHOT.method("delete"));
        assertEquals("iscsi.targetextent.query", ResourceKind.ISCSI_TARGET_EXTENT.method("query"));
    }

    @Test
    void fromWireName_roundTrips() {
        for (ResourceKind kind : ResourceKind.values()) {
            assertSame(kind, ResourceKind.fromWireName(kind.wireName()));
        }
        assertNull(ResourceKind.fromWireName("no.such.kind"));
    }
}
