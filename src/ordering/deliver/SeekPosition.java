/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package ordering.deliver;

import org.hyperledger.fabric.protos.orderer.Ab;

/**
 * Start or stop position of a deliver request. The only variants are
 * {@link Oldest}, {@link Newest} and {@link Specified}.
 *
 * @author joao
 */
public abstract class SeekPosition {

    /** Block number meaning "no upper bound" (max unsigned 64-bit value). */
    public static final long MAX_BLOCK_NUMBER = 0xFFFFFFFFFFFFFFFFL;

    private static final Oldest OLDEST = new Oldest();
    private static final Newest NEWEST = new Newest();

    private SeekPosition() {
    }

    public static SeekPosition oldest() {
        return OLDEST;
    }

    public static SeekPosition newest() {
        return NEWEST;
    }

    public static SeekPosition specified(long number) {
        return new Specified(number);
    }

    public abstract Ab.SeekPosition toProto();

    public static final class Oldest extends SeekPosition {

        private Oldest() {
        }

        @Override
        public Ab.SeekPosition toProto() {
            return Ab.SeekPosition.newBuilder().setOldest(Ab.SeekOldest.getDefaultInstance()).build();
        }

        @Override
        public String toString() {
            return "oldest";
        }
    }

    public static final class Newest extends SeekPosition {

        private Newest() {
        }

        @Override
        public Ab.SeekPosition toProto() {
            return Ab.SeekPosition.newBuilder().setNewest(Ab.SeekNewest.getDefaultInstance()).build();
        }

        @Override
        public String toString() {
            return "newest";
        }
    }

    public static final class Specified extends SeekPosition {

        private final long number;

        private Specified(long number) {
            this.number = number;
        }

        public long getNumber() {
            return number;
        }

        @Override
        public Ab.SeekPosition toProto() {
            return Ab.SeekPosition.newBuilder().setSpecified(Ab.SeekSpecified.newBuilder().setNumber(number)).build();
        }

        @Override
        public boolean equals(Object o) {
            return (o instanceof Specified) && ((Specified) o).number == number;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(number);
        }

        @Override
        public String toString() {
            return "block " + Long.toUnsignedString(number);
        }
    }
}
