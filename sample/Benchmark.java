import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.maxmind.net.Network;
import com.maxmind.net.NetworkRange;
import com.maxmind.net.Supernetter;

public class Benchmark {

    private final static int COUNT = 1000000;
    private final static int WARMUPS = 3;
    private final static int BENCHMARKS = 5;
    private final static boolean TRACE = false;

    public static void main(String[] args) throws UnknownHostException {
        int prefixLength = args.length > 0 ? Integer.parseInt(args[0]) : 24;

        System.out.println("Parsing");
        loop("Warming up", WARMUPS, prefixLength, Benchmark::benchParse);
        loop("Benchmarking", BENCHMARKS, prefixLength, Benchmark::benchParse);

        System.out.println("Splitting and merging");
        loop("Warming up", WARMUPS, prefixLength, Benchmark::benchSubnet);
        loop("Benchmarking", BENCHMARKS, prefixLength, Benchmark::benchSubnet);
    }

    private interface Bench {
        void run(int count, int seed, int prefixLength) throws UnknownHostException;
    }

    private static void loop(String msg, int loops, int prefixLength, Bench bench) throws UnknownHostException {
        System.out.println(msg);
        for (int i = 0; i < loops; i++) {
            bench.run(COUNT, i, prefixLength);
        }
        System.out.println();
    }

    private static void benchParse(int count, int seed, int prefixLength) throws UnknownHostException {
        Random random = new Random(seed);
        long startTime = System.nanoTime();
        byte[] address = new byte[4];
        for (int i = 0; i < count; i++) {
            random.nextBytes(address);
            InetAddress ip = InetAddress.getByAddress(address);
            Network network = Network.parse(ip.getHostAddress() + "/" + prefixLength);
            if (TRACE) {
                if (i % 50000 == 0) {
                    System.out.println(i + " " + ip);
                    System.out.println(network.print());
                }
            }
        }
        long endTime = System.nanoTime();

        report(count, endTime - startTime);
    }

    private static void benchSubnet(int count, int seed, int prefixLength) {
        Network parent = Network.parse("10.0.0.0/8");
        NetworkRange subnets = parent.subnet(Math.max(prefixLength, parent.prefixLength()));
        int size = subnets.count().min(BigInteger.valueOf(count)).intValue();

        long startTime = System.nanoTime();
        List<Network> children = new ArrayList<>(size);
        Random random = new Random(seed);
        for (int i = 0; i < size; i++) {
            children.add(subnets.get(random.nextInt(size)));
        }
        List<Network> merged = Supernetter.supernetAll(children);
        long endTime = System.nanoTime();

        if (TRACE) {
            System.out.println(merged.size() + " networks after merging " + size);
        }
        report(size, endTime - startTime);
    }

    private static void report(int count, long duration) {
        long qps = count * 1000000000L / duration;
        System.out.println("Operations per second: " + qps);
    }
}
