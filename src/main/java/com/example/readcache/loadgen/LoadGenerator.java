package com.example.readcache.loadgen;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Drives a running read-cache instance over HTTP.
 *
 * Usage: java LoadGenerator <scenario> [durationSeconds] [threads] ...
 *   A [duration] [threads] [categories] [alpha]  Zipfian category/page reads
 *   B [duration] [threads]                       stampede on a single listing
 *   C [duration] [threads] [invalidateEveryMs]   reads mixed with invalidations
 */
public class LoadGenerator {

    private static final HttpClient client = HttpClient.newHttpClient();
    private static final String BASE_URL = System.getProperty("readcache.url", "http://localhost:8080");
    private static final int PAGES_PER_CATEGORY = 12;

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            System.out.println("Usage: java LoadGenerator <A|B|C> [durationSeconds] [threads] ...");
            return;
        }

        String scenario = args[0];
        int duration = args.length > 1 ? Integer.parseInt(args[1]) : 60;
        System.out.println("Starting Scenario: " + scenario + " Duration: " + duration + "s");

        switch (scenario) {
            case "A": {
                int threads = args.length > 2 ? Integer.parseInt(args[2]) : 50;
                int categories = args.length > 3 ? Integer.parseInt(args[3]) : 40;
                double alpha = args.length > 4 ? Double.parseDouble(args[4]) : 0.9;
                runZipfianReads(duration, threads, categories, alpha);
                break;
            }
            case "B": {
                int threads = args.length > 2 ? Integer.parseInt(args[2]) : 100;
                runStampede(duration, threads);
                break;
            }
            case "C": {
                int threads = args.length > 2 ? Integer.parseInt(args[2]) : 50;
                long invalidateEveryMs = args.length > 3 ? Long.parseLong(args[3]) : 2_000;
                runReadsWithInvalidation(duration, threads, invalidateEveryMs);
                break;
            }
            default:
                System.out.println("Unknown scenario: " + scenario);
        }
        printStats();
    }

    // Scenario A: popular categories and first pages dominate
    private static void runZipfianReads(int durationSeconds, int threads, int categories, double alpha) throws Exception {
        final ZipfDistribution categoryDist = new ZipfDistribution(categories, alpha);
        final ZipfDistribution pageDist = new ZipfDistribution(PAGES_PER_CATEGORY, alpha);
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong requestCount = new AtomicLong();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        System.out.println(String.format("Scenario A (Categories=%d, Threads=%d, Alpha=%.2f)", categories, threads, alpha));

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                Random rand = new Random();
                while (System.currentTimeMillis() < endTime) {
                    String entity = rand.nextBoolean() ? "controls" : "faqs";
                    int category = categoryDist.sample();
                    int page = pageDist.sample() - 1;
                    String path = "/" + entity + "?first=10&after=" + (page * 10) + "&category=cat-" + category;
                    timedGet(path, latencies, requestCount);
                }
            });
        }
        finish(executor, durationSeconds);
        report("Scenario A", requestCount, latencies);
    }

    // Scenario B: every thread hammers the same listing; TTL expiries become stampedes without single-flight
    private static void runStampede(int durationSeconds, int threads) throws Exception {
        String hotPath = "/controls?first=10&category=soc2";
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong requestCount = new AtomicLong();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        System.out.println(String.format("Scenario B (Threads=%d, Duration=%ds)", threads, durationSeconds));

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                while (System.currentTimeMillis() < endTime) {
                    timedGet(hotPath, latencies, requestCount);
                    try {
                        Thread.sleep(1);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                }
            });
        }
        finish(executor, durationSeconds);
        report("Scenario B", requestCount, latencies);
    }

    // Scenario C: steady reads while a writer keeps invalidating one entity
    private static void runReadsWithInvalidation(int durationSeconds, int threads, long invalidateEveryMs) throws Exception {
        ConcurrentLinkedQueue<Double> latencies = new ConcurrentLinkedQueue<>();
        AtomicLong requestCount = new AtomicLong();
        AtomicLong invalidations = new AtomicLong();
        long endTime = System.currentTimeMillis() + durationSeconds * 1000L;

        System.out.println(String.format("Scenario C (Threads=%d, InvalidateEvery=%dms)", threads, invalidateEveryMs));

        ExecutorService executor = Executors.newFixedThreadPool(threads + 1);
        executor.submit(() -> {
            while (System.currentTimeMillis() < endTime) {
                try {
                    send(HttpRequest.newBuilder(URI.create(BASE_URL + "/invalidate/controls"))
                            .POST(HttpRequest.BodyPublishers.noBody())
                            .build());
                    invalidations.incrementAndGet();
                    Thread.sleep(invalidateEveryMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (Exception e) {
                    System.out.println("Invalidation failed: " + e.getMessage());
                }
            }
        });
        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                Random rand = new Random();
                while (System.currentTimeMillis() < endTime) {
                    String entity = rand.nextDouble() < 0.7 ? "controls" : "faqs";
                    timedGet("/" + entity + "?first=10&category=cat-" + rand.nextInt(10), latencies, requestCount);
                }
            });
        }
        finish(executor, durationSeconds);
        report("Scenario C", requestCount, latencies);
        System.out.println("Invalidations sent: " + invalidations.get());
    }

    private static void timedGet(String path, ConcurrentLinkedQueue<Double> latencies, AtomicLong requestCount) {
        try {
            long start = System.currentTimeMillis();
            send(HttpRequest.newBuilder(URI.create(BASE_URL + path)).GET().build());
            latencies.add((double) (System.currentTimeMillis() - start));
            requestCount.incrementAndGet();
        } catch (Exception e) {
            System.out.println("Request failed: " + path + " " + e.getMessage());
        }
    }

    private static void send(HttpRequest request) throws Exception {
        client.send(request, HttpResponse.BodyHandlers.discarding());
    }

    private static void finish(ExecutorService executor, int durationSeconds) throws InterruptedException {
        executor.shutdown();
        executor.awaitTermination(durationSeconds + 10, TimeUnit.SECONDS);
    }

    private static void report(String name, AtomicLong requestCount, ConcurrentLinkedQueue<Double> latencies) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        latencies.forEach(stats::addValue);
        System.out.println(name + " finished. Requests: " + requestCount.get());
        System.out.println(String.format("Stats: Avg=%.2fms, P95=%.2fms, P99=%.2fms, Max=%.2fms",
                stats.getMean(), stats.getPercentile(95), stats.getPercentile(99), stats.getMax()));
    }

    private static void printStats() throws Exception {
        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(URI.create(BASE_URL + "/stats")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        System.out.println("Server stats: " + response.body());
    }
}
