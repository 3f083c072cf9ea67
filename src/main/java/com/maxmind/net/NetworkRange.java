package com.maxmind.net;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The subnets of a network at a longer prefix length, in ascending order.
 *
 * <p>Subnets are computed on demand: {@link #get(BigInteger)} returns the
 * subnet at any offset without producing the ones before it, and each
 * iteration starts again from the first subnet. Nothing is materialized, so
 * splitting an IPv6 /0 into /128s is as cheap as splitting a /24 in two.</p>
 */
public final class NetworkRange implements Iterable<Network> {
    private final Network parent;
    private final int prefixLength;
    private final BigInteger count;
    private final BigInteger step;

    NetworkRange(Network parent, int prefixLength) {
        int width = parent.family().bitLength();
        this.parent = parent;
        this.prefixLength = prefixLength;
        this.count = BigInteger.ONE.shiftLeft(prefixLength - parent.prefixLength());
        this.step = BigInteger.ONE.shiftLeft(width - prefixLength);
    }

    /**
     * @return the network that was split.
     */
    public Network parent() {
        return parent;
    }

    /**
     * @return the prefix length of every subnet.
     */
    public int prefixLength() {
        return prefixLength;
    }

    /**
     * @return the number of subnets, {@code 2^(prefixLength - parent.prefixLength)}.
     */
    public BigInteger count() {
        return count;
    }

    /**
     * @param index the offset of the subnet, from zero
     * @return the subnet starting at {@code parent + index * subnetSize}.
     * @throws IndexOutOfBoundsException if the index is negative or not less
     *                                   than {@link #count()}.
     */
    public Network get(BigInteger index) {
        if (index.signum() < 0 || index.compareTo(count) >= 0) {
            throw new IndexOutOfBoundsException("Index " + index + " is outside 0.." + count.subtract(BigInteger.ONE));
        }
        return new Network(parent.value().add(index.multiply(step)), parent.family(), prefixLength);
    }

    /**
     * @param index the offset of the subnet, from zero
     * @return the subnet at the offset.
     * @see #get(BigInteger)
     */
    public Network get(long index) {
        return get(BigInteger.valueOf(index));
    }

    @Override
    public Iterator<Network> iterator() {
        return new SubnetIterator();
    }

    /**
     * @return a sequential, lazily evaluated stream of the subnets.
     */
    public Stream<Network> stream() {
        int characteristics = Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL
            | Spliterator.IMMUTABLE;
        Spliterator<Network> spliterator = count.bitLength() < Long.SIZE
            ? Spliterators.spliterator(iterator(), count.longValue(), characteristics)
            : Spliterators.spliteratorUnknownSize(iterator(), characteristics);
        return StreamSupport.stream(spliterator, false);
    }

    @Override
    public String toString() {
        return parent + " split into " + count + " /" + prefixLength + " subnets";
    }

    private final class SubnetIterator implements Iterator<Network> {
        private BigInteger next = BigInteger.ZERO;

        @Override
        public boolean hasNext() {
            return next.compareTo(count) < 0;
        }

        @Override
        public Network next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Network network = get(next);
            next = next.add(BigInteger.ONE);
            return network;
        }
    }
}
