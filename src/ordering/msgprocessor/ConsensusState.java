/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.msgprocessor;

/**
 * Consensus state of the system channel, changed only by reconfiguration transactions.
 *
 * @author joao
 */
public enum ConsensusState {

    NORMAL(0),
    MAINTENANCE(1);

    private final int value;

    ConsensusState(int value) {
        this.value = value;
    }

    /** Wire value of {@code orderer.ConsensusType.State}. */
    public int getValue() {
        return value;
    }

    public static ConsensusState fromValue(int value) {

        for (ConsensusState s : values()) {
            if (s.value == value) return s;
        }
        throw new IllegalArgumentException("Unknown consensus state " + value);
    }
}
