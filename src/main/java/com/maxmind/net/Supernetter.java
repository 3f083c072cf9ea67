package com.maxmind.net;

import java.math.BigInteger;
import java.net.InetAddress;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Merges networks into covering supernets.
 */
public final class Supernetter {

    private Supernetter() {
    }

    /**
     * Merges two networks. If one contains the other the containing network is
     * returned. Otherwise the networks must be the two halves of a network one
     * bit shorter: the same size, contiguous and starting on that network's
     * boundary.
     *
     * @param first  a network
     * @param second another network of the same family
     * @return the network covering both.
     * @throws MixedAddressFamilyException if the families differ.
     * @throws NotAdjacentException        if the networks differ in size or
     *                                     are not contiguous.
     * @throws MisalignedBoundaryException if the networks are contiguous but do
     *                                     not form a single CIDR block.
     */
    public static Network supernet(Network first, Network second) {
        return merge(first, second).getOrThrow();
    }

    /**
     * @param first  a network
     * @param second another network
     * @return the network covering both, or empty if they cannot be merged.
     * @see #supernet(Network, Network)
     */
    public static Optional<Network> trySupernet(Network first, Network second) {
        return merge(first, second).toOptional();
    }

    /**
     * Merges a collection of networks into covering supernets. Null entries
     * are ignored.
     *
     * <p>The networks are sorted and then repeatedly merged pairwise, using a
     * stack, until a pass merges nothing. This greedy merge only combines
     * neighbours on the stack, so it is not guaranteed to find the smallest
     * possible cover for every input, but it always reassembles a complete
     * set of subnets into their parent.</p>
     *
     * @param networks the networks to merge
     * @return the merged networks.
     * @throws EmptyInputException if the collection is null.
     */
    public static List<Network> supernetAll(Collection<Network> networks) {
        return mergeAll(networks).getOrThrow();
    }

    /**
     * @param networks the networks to merge
     * @return the merged networks, or empty if the collection is null.
     * @see #supernetAll(Collection)
     */
    public static Optional<List<Network>> trySupernetAll(Collection<Network> networks) {
        return mergeAll(networks).toOptional();
    }

    /**
     * @param start the first address
     * @param end   the last address
     * @return the longest-prefix network based at {@code start} that also
     *         contains {@code end}.
     * @throws EmptyInputException         if either address is null or empty.
     * @throws MalformedAddressException   if either address is not a literal.
     * @throws MixedAddressFamilyException if the families differ.
     */
    public static Network wideSubnet(String start, String end) {
        return widen(start, end).getOrThrow();
    }

    /**
     * @param start the first address
     * @param end   the last address
     * @return the widened network, or empty if the inputs are invalid.
     * @see #wideSubnet(String, String)
     */
    public static Optional<Network> tryWideSubnet(String start, String end) {
        return widen(start, end).toOptional();
    }

    /**
     * @param networks networks of a single family; null entries are ignored
     * @return the longest-prefix network based at the lowest network that
     *         contains every address of every network.
     * @throws EmptyInputException         if there are no networks.
     * @throws MixedAddressFamilyException if the families differ.
     */
    public static Network wideSubnet(Collection<Network> networks) {
        return widen(networks).getOrThrow();
    }

    /**
     * @param networks networks of a single family
     * @return the widened network, or empty if there are no networks or the
     *         families differ.
     * @see #wideSubnet(Collection)
     */
    public static Optional<Network> tryWideSubnet(Collection<Network> networks) {
        return widen(networks).toOptional();
    }

    static Result<Network> merge(Network a, Network b) {
        if (a == null || b == null) {
            return Result.fail(() -> new EmptyInputException("network"));
        }
        if (a.family() != b.family()) {
            return Result.fail(() -> new MixedAddressFamilyException(a.family(), b.family()));
        }
        if (a.contains(b)) {
            return Result.of(a);
        }
        if (b.contains(a)) {
            return Result.of(b);
        }
        if (a.prefixLength() != b.prefixLength()) {
            return Result.fail(() -> new NotAdjacentException(a, b));
        }

        // Same size and disjoint from here on.
        Network first = a.value().compareTo(b.value()) < 0 ? a : b;
        Network last = first == a ? b : a;
        if (!first.broadcastValue().add(BigInteger.ONE).equals(last.value())) {
            return Result.fail(() -> new NotAdjacentException(first, last));
        }

        Network merged = new Network(first.value(), first.family(), first.prefixLength() - 1);
        if (!merged.value().equals(first.value())) {
            return Result.fail(() -> new MisalignedBoundaryException(first, last));
        }
        return Result.of(merged);
    }

    static Result<List<Network>> mergeAll(Collection<Network> networks) {
        if (networks == null) {
            return Result.fail(() -> new EmptyInputException("network collection"));
        }
        List<Network> sorted = networks.stream()
            .filter(Objects::nonNull)
            .sorted()
            .collect(Collectors.toCollection(ArrayList::new));
        // Pushing the descending list leaves the lowest network on top.
        Collections.reverse(sorted);

        Deque<Network> current = toStack(sorted);
        List<Network> merged = new ArrayList<>();
        int previousCount = 0;
        int currentCount = current.size();

        while (previousCount != currentCount) {
            merged = new ArrayList<>();
            while (current.size() > 1) {
                Network top = current.pop();
                Result<Network> supernet = merge(top, current.peek());
                if (supernet.isPresent()) {
                    current.pop();
                    current.push(supernet.getOrThrow());
                } else {
                    merged.add(top);
                }
            }
            if (current.size() == 1) {
                merged.add(current.pop());
            }

            previousCount = currentCount;
            currentCount = merged.size();
            current = toStack(merged);
        }
        return Result.of(Collections.unmodifiableList(merged));
    }

    private static Deque<Network> toStack(List<Network> networks) {
        Deque<Network> stack = new ArrayDeque<>(networks.size());
        for (Network network : networks) {
            stack.push(network);
        }
        return stack;
    }

    static Result<Network> widen(String start, String end) {
        if (start == null || start.isEmpty()) {
            return Result.fail(() -> new EmptyInputException("start address"));
        }
        if (end == null || end.isEmpty()) {
            return Result.fail(() -> new EmptyInputException("end address"));
        }
        return AddressCodec.parseAddress(start).flatMap(startIp ->
            AddressCodec.parseAddress(end).flatMap(endIp -> widen(startIp, endIp)));
    }

    private static Result<Network> widen(InetAddress start, InetAddress end) {
        AddressFamily family = AddressFamily.of(start);
        AddressFamily endFamily = AddressFamily.of(end);
        if (family != endFamily) {
            return Result.fail(() -> new MixedAddressFamilyException(family, endFamily));
        }
        return Result.of(widest(AddressCodec.toBigInteger(start), family, family.bitLength(),
            AddressCodec.toBigInteger(end)));
    }

    static Result<Network> widen(Collection<Network> networks) {
        if (networks == null) {
            return Result.fail(() -> new EmptyInputException("network collection"));
        }
        List<Network> present = networks.stream()
            .filter(Objects::nonNull)
            .sorted()
            .collect(Collectors.toList());
        if (present.isEmpty()) {
            return Result.fail(() -> new EmptyInputException("network collection"));
        }

        Network lowest = present.get(0);
        BigInteger highest = lowest.broadcastValue();
        for (Network network : present) {
            if (network.family() != lowest.family()) {
                return Result.fail(() -> new MixedAddressFamilyException(lowest.family(), network.family()));
            }
            highest = highest.max(network.broadcastValue());
        }
        return Result.of(widest(lowest.value(), lowest.family(), lowest.prefixLength(), highest));
    }

    // Shortens the prefix of the network at base until it reaches address.
    // Prefix length zero covers every address, so this always terminates.
    private static Network widest(BigInteger base, AddressFamily family, int longest, BigInteger address) {
        for (int prefixLength = longest; prefixLength > 0; prefixLength--) {
            Network candidate = new Network(base, family, prefixLength);
            if (candidate.broadcastValue().compareTo(address) >= 0 && candidate.value().compareTo(address) <= 0) {
                return candidate;
            }
        }
        return new Network(base, family, 0);
    }
}
