package com.pdp.loader;

import com.pdp.common.BrowsingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Seeded generator of synthetic browsing histories.
 *
 * Each user gets a category-A preference ~ Beta(2,2) and a follow-up preference ~ Beta(2,3).
 * Within a session every visit is a category-A site with the A preference; otherwise, right
 * after an A visit, a category-B site with the follow-up preference; otherwise a uniformly
 * random site from the whole catalog.
 */
public class SyntheticHistoryGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SyntheticHistoryGenerator.class);

    public static final String CATEGORY_A = "short_video";
    public static final String CATEGORY_B = "ecommerce";

    public static final LocalDate START_DATE = LocalDate.of(2024, 1, 1);
    public static final LocalDate END_DATE = LocalDate.of(2025, 3, 31);

    private static final int MIN_SITES_PER_SESSION = 5;
    private static final int MAX_SITES_PER_SESSION = 20;
    private static final int MIN_DURATION_S = 10;
    private static final int MAX_DURATION_S = 1800;

    /** Site catalog by category. */
    public static final Map<String, List<String>> SITE_CATALOG;

    static {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put(CATEGORY_A, List.of(
                "tiktok.com", "youtube.com/shorts", "instagram.com/reels",
                "snapchat.com", "vimeo.com/shorts", "triller.co", "byte.co",
                "dubsmash.com", "likee.com", "funimate.com"));
        m.put(CATEGORY_B, List.of(
                "amazon.com", "ebay.com", "walmart.com", "aliexpress.com",
                "etsy.com", "shopify.com", "bestbuy.com", "target.com",
                "newegg.com", "wayfair.com", "overstock.com", "homedepot.com"));
        m.put("social_media", List.of(
                "facebook.com", "twitter.com", "instagram.com", "linkedin.com",
                "pinterest.com", "reddit.com", "tumblr.com", "quora.com",
                "discord.com", "telegram.org", "whatsapp.com", "signal.org"));
        m.put("news", List.of(
                "cnn.com", "bbc.com", "nytimes.com", "reuters.com",
                "apnews.com", "washingtonpost.com", "theguardian.com",
                "bloomberg.com", "wsj.com", "economist.com", "time.com"));
        m.put("entertainment", List.of(
                "netflix.com", "hulu.com", "disneyplus.com", "hbomax.com",
                "primevideo.com", "spotify.com", "pandora.com", "twitch.tv",
                "crunchyroll.com", "funimation.com", "imdb.com", "rottentomatoes.com"));
        m.put("education", List.of(
                "coursera.org", "udemy.com", "edx.org", "khanacademy.org",
                "duolingo.com", "brilliant.org", "skillshare.com", "codecademy.com",
                "udacity.com", "pluralsight.com", "lynda.com", "masterclass.com"));
        m.put("productivity", List.of(
                "google.com/docs", "office.com", "notion.so", "evernote.com",
                "trello.com", "asana.com", "monday.com", "slack.com",
                "zoom.us", "dropbox.com", "box.com", "drive.google.com"));
        m.put("technology", List.of(
                "github.com", "stackoverflow.com", "medium.com", "dev.to",
                "techcrunch.com", "wired.com", "theverge.com", "cnet.com",
                "engadget.com", "arstechnica.com", "hackernoon.com", "slashdot.org"));
        SITE_CATALOG = Collections.unmodifiableMap(m);
    }

    private static final List<String> ALL_SITES;

    static {
        List<String> all = new ArrayList<>();
        SITE_CATALOG.values().forEach(all::addAll);
        ALL_SITES = List.copyOf(all);
    }

    private final Random random;
    private final long startEpoch;
    private final int rangeDays;

    public SyntheticHistoryGenerator(long seed) {
        this.random = new Random(seed);
        this.startEpoch = START_DATE.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        this.rangeDays = (int) ChronoUnit.DAYS.between(START_DATE, END_DATE);
    }

    public static String dateRange() {
        return START_DATE + " to " + END_DATE;
    }

    /**
     * Generates {@code users} users with a history length uniform in [minEvents, maxEvents].
     */
    public List<SyntheticUser> generateUsers(int users, int minEvents, int maxEvents) {
        if (users < 0 || minEvents < 0 || maxEvents < minEvents) {
            throw new IllegalArgumentException("Invalid synthetic population shape: users=" + users
                    + " events=[" + minEvents + "," + maxEvents + "]");
        }
        List<SyntheticUser> out = new ArrayList<>(users);
        for (int i = 0; i < users; i++) {
            int numEvents = minEvents + random.nextInt(maxEvents - minEvents + 1);
            out.add(generateUser(numEvents));
        }
        logger.info("Generated {} synthetic users ({}..{} events each)", users, minEvents, maxEvents);
        return out;
    }

    /** Same as {@link #generateUsers} but returned as a ready-to-query index. */
    public InMemoryPopulationIndex generatePopulation(int users, int minEvents, int maxEvents) {
        InMemoryPopulationIndex index = new InMemoryPopulationIndex(dateRange());
        for (SyntheticUser u : generateUsers(users, minEvents, maxEvents)) {
            index.put(u.userId(), u.events());
        }
        return index;
    }

    public SyntheticUser generateUser(int numEvents) {
        String userId = new UUID(random.nextLong(), random.nextLong()).toString();
        double aPref = beta(2, 2);
        double followPref = beta(2, 3);

        List<BrowsingEvent> events = new ArrayList<>(numEvents + MAX_SITES_PER_SESSION);
        while (events.size() < numEvents) {
            events.addAll(generateSession(userId, aPref, followPref));
        }
        events = new ArrayList<>(events.subList(0, numEvents));
        events.sort(Comparator.comparingLong(BrowsingEvent::getTimestamp));
        return new SyntheticUser(userId, aPref, followPref, events);
    }

    /** One session of 5..20 visits with sorted timestamps. */
    List<BrowsingEvent> generateSession(String userId, double aPref, double followPref) {
        int numSites = MIN_SITES_PER_SESSION + random.nextInt(MAX_SITES_PER_SESSION - MIN_SITES_PER_SESSION + 1);
        long[] timestamps = new long[numSites];
        for (int i = 0; i < numSites; i++) {
            timestamps[i] = randomTimestamp();
        }
        Arrays.sort(timestamps);

        List<BrowsingEvent> session = new ArrayList<>(numSites);
        boolean lastWasA = false;
        for (int i = 0; i < numSites; i++) {
            String site;
            if (random.nextDouble() < aPref) {
                site = pick(SITE_CATALOG.get(CATEGORY_A));
                lastWasA = true;
            } else if (lastWasA && random.nextDouble() < followPref) {
                site = pick(SITE_CATALOG.get(CATEGORY_B));
                lastWasA = false;
            } else {
                site = pick(ALL_SITES);
                lastWasA = SITE_CATALOG.get(CATEGORY_A).contains(site);
            }
            int duration = MIN_DURATION_S + random.nextInt(MAX_DURATION_S - MIN_DURATION_S + 1);
            String referrer = (i > 0) ? session.get(i - 1).getSite() : "direct";
            session.add(new BrowsingEvent(userId, timestamps[i], site, duration, referrer));
        }
        return session;
    }

    private long randomTimestamp() {
        return startEpoch + (long) random.nextInt(rangeDays) * 86_400L + random.nextInt(86_400);
    }

    private String pick(List<String> sites) {
        return sites.get(random.nextInt(sites.size()));
    }

    /** Beta(a, b) for integer shapes: the a-th smallest of a+b-1 uniforms. */
    private double beta(int a, int b) {
        double[] u = new double[a + b - 1];
        for (int i = 0; i < u.length; i++) {
            u[i] = random.nextDouble();
        }
        Arrays.sort(u);
        return u[a - 1];
    }
}
