package com.golfdata.clubtracker.crawl.source;

import com.golfdata.clubtracker.config.PipelineProperties;
import com.golfdata.clubtracker.crawl.http.PoliteFetcher;
import com.golfdata.clubtracker.crawl.http.RequestRateLimiter;
import com.golfdata.clubtracker.crawl.http.UserAgentRotator;
import com.golfdata.clubtracker.crawl.model.RawListing;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobalGolfSourceAdapterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC);

    private MockWebServer server;
    private ExecutorService executor;
    private PipelineProperties properties;
    private GlobalGolfSourceAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.setDispatcher(new FixtureDispatcher());
        server.start();

        properties = new PipelineProperties();
        properties.getFetch().setPostRequestDelayMs(0);
        properties.getFetch().setMaxAttempts(2);
        properties.getFetch().setRetryBaseDelayMs(1);
        properties.getFetch().setRetryMaxDelayMs(2);
        properties.getFetch().setRequestTimeoutSeconds(5);
        PipelineProperties.Source source = new PipelineProperties.Source();
        source.setBaseUrl(server.url("/").toString());
        properties.getSources().put(GlobalGolfSourceAdapter.KEY, source);

        executor = Executors.newFixedThreadPool(2);
        PoliteFetcher fetcher = new PoliteFetcher(
            properties,
            executor,
            RequestRateLimiter.unlimited(),
            new UserAgentRotator(properties)
        );
        adapter = new GlobalGolfSourceAdapter(fetcher, properties, CLOCK);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void extractsListingsAndStopsOnEmptyPage() {
        CategoryCrawl crawl = adapter.listCategory("drivers", 1, null);

        List<RawListing> listings = drain(crawl);

        assertThat(listings).hasSize(2);
        RawListing tsr3 = listings.get(0);
        assertThat(tsr3.source()).isEqualTo(GlobalGolfSourceAdapter.SOURCE_NAME);
        assertThat(tsr3.brandText()).isEqualTo("Titleist");
        assertThat(tsr3.modelText()).isEqualTo("TSR3 Driver");
        assertThat(tsr3.clubType()).isEqualTo("drivers");
        assertThat(tsr3.price()).isEqualByComparingTo(new BigDecimal("599.99"));
        assertThat(tsr3.listPrice()).isEqualByComparingTo(new BigDecimal("629.00"));
        assertThat(tsr3.detailUrl()).isEqualTo(server.url("/titleist-tsr3-driver/p-1001").toString());
        assertThat(tsr3.inStock()).isTrue();
        assertThat(tsr3.modelYear()).isNull();

        RawListing stealth = listings.get(1);
        assertThat(stealth.brandText()).isEqualTo("TaylorMade");
        assertThat(stealth.price()).isNull();
        assertThat(stealth.inStock()).isFalse();
        assertThat(stealth.modelYear()).isEqualTo(2023);

        assertThat(crawl.pagesFetched()).isEqualTo(2);
        assertThat(crawl.skippedItems()).isEqualTo(1);
        assertThat(crawl.pageErrors()).isZero();
    }

    @Test
    void passesBrandFilterAsQueryParameter() throws Exception {
        drain(adapter.listCategory("drivers", 1, "Titleist"));

        RecordedRequest first = server.takeRequest();
        assertThat(first.getRequestUrl().encodedPath()).isEqualTo("/golf-clubs/drivers/");
        assertThat(first.getRequestUrl().queryParameter("page")).isEqualTo("1");
        assertThat(first.getRequestUrl().queryParameter("brand")).isEqualTo("Titleist");
    }

    @Test
    void honoursPageCeiling() {
        properties.getCrawl().setMaxPagesPerCategory(1);

        CategoryCrawl crawl = adapter.listCategory("drivers", 1, null);
        drain(crawl);

        assertThat(crawl.pagesFetched()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void iterationRestartsFromStartPage() {
        CategoryCrawl crawl = adapter.listCategory("drivers", 1, null);

        List<RawListing> first = drain(crawl);
        List<RawListing> second = drain(crawl);

        assertThat(second).isEqualTo(first);
        assertThat(server.getRequestCount()).isEqualTo(4);
        assertThat(crawl.pagesFetched()).isEqualTo(2);
    }

    @Test
    void unreachableCategoryPageAbortsCategory() {
        CategoryCrawl crawl = adapter.listCategory("irons", 1, null);

        List<RawListing> listings = drain(crawl);

        assertThat(listings).isEmpty();
        assertThat(crawl.pagesFetched()).isZero();
        assertThat(crawl.pageErrors()).isEqualTo(1);
        assertThat(crawl.lastError()).isNotNull();
        assertThat(crawl.aborted()).isTrue();
    }

    @Test
    void rejectsUnknownCategory() {
        assertThatThrownBy(() -> adapter.listCategory("balls", 1, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(adapter.categories())
            .containsExactly("drivers", "fairway-woods", "hybrids", "irons", "wedges", "putters");
    }

    @Test
    void readsDetailPage() {
        Optional<RawListing> detail = adapter.fetchDetail(server.url("/titleist-tsr3-driver/p-1001").toString());

        assertThat(detail).isPresent();
        assertThat(detail.get().price()).isEqualByComparingTo(new BigDecimal("549.99"));
        assertThat(detail.get().modelYear()).isEqualTo(2022);
        assertThat(detail.get().clubType()).isEqualTo("Driver");
        assertThat(detail.get().inStock()).isTrue();
        assertThat(detail.get().brandText()).isEqualTo("Titleist");
    }

    @Test
    void missingDetailPageIsEmpty() {
        assertThat(adapter.fetchDetail(server.url("/gone").toString())).isEmpty();
    }

    @Test
    void unreachableDetailPageThrows() {
        assertThatThrownBy(() -> adapter.fetchDetail(server.url("/broken").toString()))
            .isInstanceOf(SourceFetchException.class)
            .satisfies(e -> assertThat(((SourceFetchException) e).getError()).isNotNull());
    }

    private static List<RawListing> drain(Iterable<RawListing> listings) {
        List<RawListing> out = new ArrayList<>();
        for (RawListing listing : listings) {
            out.add(listing);
        }
        return out;
    }

    private static String fixture(String name) {
        try (InputStream in = GlobalGolfSourceAdapterTest.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalStateException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static class FixtureDispatcher extends Dispatcher {
        @Override
        public MockResponse dispatch(RecordedRequest request) {
            String path = request.getRequestUrl().encodedPath();
            String page = request.getRequestUrl().queryParameter("page");
            if (path.equals("/golf-clubs/drivers/")) {
                String body = "1".equals(page)
                    ? fixture("globalgolf-drivers-page1.html")
                    : fixture("globalgolf-empty-page.html");
                return html(body);
            }
            if (path.equals("/titleist-tsr3-driver/p-1001")) {
                return html(fixture("globalgolf-detail.html"));
            }
            if (path.equals("/gone")) {
                return new MockResponse().setResponseCode(404).setBody("not found");
            }
            return new MockResponse().setResponseCode(500).setBody("error");
        }

        private static MockResponse html(String body) {
            return new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "text/html; charset=utf-8")
                .setBody(body);
        }
    }
}
