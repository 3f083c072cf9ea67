package com.maxmind.net;

import java.math.BigInteger;
import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The addresses of a network selected by an {@link AddressFilter}, in
 * ascending order.
 *
 * <p>Addresses are computed on demand from their offset, so the count is
 * known without enumerating and an IPv6 /0 can be walked without holding
 * more than one address. Each iteration starts again from the first
 * address.</p>
 */
public final class AddressRange implements Iterable<InetAddress> {
    private final Network network;
    private final AddressFilter filter;
    private final List<Span> spans;
    private final BigInteger count;

    AddressRange(Network network, AddressFilter filter) {
        if (filter == null) {
            throw new NullPointerException("Filter cannot be null");
        }
        this.network = network;
        this.filter = filter;
        this.spans = spans(network, filter);
        BigInteger total = BigInteger.ZERO;
        for (Span span : spans) {
            total = total.add(span.length());
        }
        this.count = total;
    }

    // Contiguous runs of addresses. UNUSABLE is the only filter that needs two.
    private static List<Span> spans(Network network, AddressFilter filter) {
        BigInteger first = network.value();
        BigInteger last = network.broadcastValue();
        BigInteger total = network.total();
        boolean ipv6 = network.family() == AddressFamily.IPV6;
        boolean hasUsable = network.usable().signum() > 0;

        switch (filter) {
            case ALL:
                return List.of(new Span(first, total));
            case USABLE:
                if (ipv6) {
                    return List.of(new Span(first, total));
                }
                return hasUsable
                    ? List.of(new Span(first.add(BigInteger.ONE), network.usable()))
                    : Collections.emptyList();
            case UNUSABLE:
                if (ipv6) {
                    return Collections.emptyList();
                }
                if (!hasUsable) {
                    return List.of(new Span(first, total));
                }
                List<Span> reserved = new ArrayList<>(2);
                reserved.add(new Span(first, BigInteger.ONE));
                reserved.add(new Span(last, BigInteger.ONE));
                return Collections.unmodifiableList(reserved);
            case BROADCAST:
                return ipv6 ? Collections.emptyList() : List.of(new Span(last, BigInteger.ONE));
            case NETWORK:
                return List.of(new Span(first, BigInteger.ONE));
            default:
                throw new IllegalArgumentException("Unknown filter " + filter);
        }
    }

    /**
     * @return the network the addresses belong to.
     */
    public Network network() {
        return network;
    }

    /**
     * @return the filter the addresses were selected with.
     */
    public AddressFilter filter() {
        return filter;
    }

    /**
     * @return the number of addresses in the range.
     */
    public BigInteger count() {
        return count;
    }

    /**
     * @param index the offset of the address, from zero
     * @return the address at the offset.
     * @throws IndexOutOfBoundsException if the index is negative or not less
     *                                   than {@link #count()}.
     */
    public InetAddress get(BigInteger index) {
        if (index.signum() < 0 || index.compareTo(count) >= 0) {
            throw new IndexOutOfBoundsException("Index " + index + " is outside a range of " + count + " addresses");
        }
        BigInteger offset = index;
        for (Span span : spans) {
            if (offset.compareTo(span.length()) < 0) {
                return AddressCodec.fromBigInteger(span.start().add(offset), network.family());
            }
            offset = offset.subtract(span.length());
        }
        throw new IllegalStateException("Index " + index + " not found in " + spans.size() + " spans");
    }

    /**
     * @param index the offset of the address, from zero
     * @return the address at the offset.
     * @see #get(BigInteger)
     */
    public InetAddress get(long index) {
        return get(BigInteger.valueOf(index));
    }

    @Override
    public Iterator<InetAddress> iterator() {
        return new AddressIterator();
    }

    /**
     * @return a sequential, lazily evaluated stream of the addresses.
     */
    public Stream<InetAddress> stream() {
        int characteristics = Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL
            | Spliterator.IMMUTABLE;
        Spliterator<InetAddress> spliterator = count.bitLength() < Long.SIZE
            ? Spliterators.spliterator(iterator(), count.longValue(), characteristics)
            : Spliterators.spliteratorUnknownSize(iterator(), characteristics);
        return StreamSupport.stream(spliterator, false);
    }

    @Override
    public String toString() {
        return count + " " + filter.name().toLowerCase() + " addresses of " + network;
    }

    private record Span(BigInteger start, BigInteger length) {}

    private final class AddressIterator implements Iterator<InetAddress> {
        private int spanIndex;
        private BigInteger offset = BigInteger.ZERO;

        @Override
        public boolean hasNext() {
            while (spanIndex < spans.size() && offset.compareTo(spans.get(spanIndex).length()) >= 0) {
                spanIndex++;
                offset = BigInteger.ZERO;
            }
            return spanIndex < spans.size();
        }

        @Override
        public InetAddress next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Span span = spans.get(spanIndex);
            InetAddress address = AddressCodec.fromBigInteger(span.start().add(offset), network.family());
            offset = offset.add(BigInteger.ONE);
            return address;
        }
    }
}
