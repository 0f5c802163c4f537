package com.jay.insight.model;

import com.jay.insight.model.enums.PeerGroup;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PeersReport {
    private String ticker;
    private Double compositeScore;
    private String industry;
    private PeerGroup peerSelection;
    private List<PeerData> peers;
    private PeerMetrics stockMetrics;
    private Double avgPeerScore;      // null when no peer has a score
    private Double vsPeersDelta;      // stock score minus the peer average
}
