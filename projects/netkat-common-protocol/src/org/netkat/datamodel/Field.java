package org.netkat.datamodel;

/**
 * The packet header fields a policy can test and modify. The switch a packet
 * is located at is modeled as one more field.
 */
public enum Field {
    IN_PORT("InPort"),
    ETH_SRC("EthSrc"),
    ETH_DST("EthDst"),
    ETH_TYPE("EthType"),
    VLAN("Vlan"),
    VLAN_PCP("VlanPcp"),
    IP_PROTO("IPProto"),
    IP4_SRC("IP4Src"),
    IP4_DST("IP4Dst"),
    TCP_SRC_PORT("TCPSrcPort"),
    TCP_DST_PORT("TCPDstPort"),
    SWITCH("Switch");

    private final String _headerName;

    Field(String headerName) {
        _headerName = headerName;
    }

    /**
     * The name of the field, as used in serialized programs.
     */
    public String headerName() {
        return _headerName;
    }

    @Override
    public String toString() {
        return _headerName;
    }
}
