package dev.reviewlens.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.reviewlens.fixture.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class SemanticResultCacheTest {

  private static final String STORED_QUESTION = "Is the staff friendly?";
  private static final String SIMILAR_QUESTION = "Are the staff friendly?";
  private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

  // cosine(BASE, AT_THRESHOLD) = 19 / 20 = 0.95 exactly
  private static final float[] BASE = {1, 0, 0, 0, 0};
  private static final float[] AT_THRESHOLD = {19, 5, 3, 2, 1};
  // cosine(BASE, BELOW_THRESHOLD) = 19 / sqrt(403), about 0.9464
  private static final float[] BELOW_THRESHOLD = {19, 5, 3, 2, 2};

  @Mock EmbeddingModel embeddingModel;

  MutableClock clock;
  CacheProperties properties;
  ObjectMapper objectMapper;
  SemanticResultCache cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    properties = new CacheProperties();
    objectMapper = JsonMapper.builder().findAndAddModules().build();
    cache =
        new SemanticResultCache(
            new InMemoryCacheStore(clock), embeddingModel, objectMapper, properties, clock);
  }

  private void stubEmbedding(String question, float[] vector) {
    when(embeddingModel.embed(question)).thenReturn(Response.from(Embedding.from(vector)));
  }

  private SemanticResultCache cacheOver(CacheStore store) {
    return new SemanticResultCache(store, embeddingModel, objectMapper, properties, clock);
  }

  private String json(CacheEntry entry) throws Exception {
    return objectMapper.writeValueAsString(entry);
  }

  // --- Lookup ---

  @Test
  void stored_question_is_a_hit_with_its_answer() {
    stubEmbedding(STORED_QUESTION, BASE);
    cache.store(STORED_QUESTION, "Yes, very friendly.", 7);

    CacheLookup lookup = cache.lookup(STORED_QUESTION);

    assertThat(lookup.isHit()).isTrue();
    assertThat(lookup.similarity()).isCloseTo(1.0, within(1e-6));
    assertThat(lookup.entry().answer()).isEqualTo("Yes, very friendly.");
    assertThat(lookup.entry().contextCount()).isEqualTo(7);
    assertThat(lookup.entry().question()).isEqualTo(STORED_QUESTION);
    assertThat(lookup.entry().createdAt()).isEqualTo(START);
  }

  @Test
  void similarity_exactly_at_threshold_is_a_hit() {
    stubEmbedding(STORED_QUESTION, BASE);
    stubEmbedding(SIMILAR_QUESTION, AT_THRESHOLD);
    cache.store(STORED_QUESTION, "answer", 3);

    CacheLookup lookup = cache.lookup(SIMILAR_QUESTION);

    assertThat(lookup.isHit()).isTrue();
    assertThat(lookup.similarity()).isEqualTo(0.95);
  }

  @Test
  void similarity_just_below_threshold_is_a_miss() {
    stubEmbedding(STORED_QUESTION, BASE);
    stubEmbedding(SIMILAR_QUESTION, BELOW_THRESHOLD);
    cache.store(STORED_QUESTION, "answer", 3);

    CacheLookup lookup = cache.lookup(SIMILAR_QUESTION);

    assertThat(lookup.isHit()).isFalse();
    assertThat(lookup.entry()).isNull();
    assertThat(lookup.similarity()).isCloseTo(0.9464, within(1e-4));
  }

  @Test
  void empty_cache_is_a_miss() {
    stubEmbedding(STORED_QUESTION, BASE);

    CacheLookup lookup = cache.lookup(STORED_QUESTION);

    assertThat(lookup.isHit()).isFalse();
    assertThat(lookup.similarity()).isZero();
  }

  @Test
  void best_entry_wins_over_first_entry() throws Exception {
    CacheStore store = mock(CacheStore.class);
    when(store.scanKeys(properties.getKeyPrefix())).thenReturn(List.of("k:far", "k:near"));
    when(store.get("k:far"))
        .thenReturn(Optional.of(json(entry("k:far", "far", BELOW_THRESHOLD, START))));
    when(store.get("k:near"))
        .thenReturn(Optional.of(json(entry("k:near", "near", BASE, START))));
    stubEmbedding(STORED_QUESTION, BASE);

    CacheLookup lookup = cacheOver(store).lookup(STORED_QUESTION);

    assertThat(lookup.entry().answer()).isEqualTo("near");
  }

  @Test
  void equal_similarity_keeps_first_scanned_entry() throws Exception {
    CacheStore store = mock(CacheStore.class);
    when(store.scanKeys(properties.getKeyPrefix())).thenReturn(List.of("k:1", "k:2"));
    when(store.get("k:1")).thenReturn(Optional.of(json(entry("k:1", "first", BASE, START))));
    when(store.get("k:2")).thenReturn(Optional.of(json(entry("k:2", "second", BASE, START))));
    stubEmbedding(STORED_QUESTION, BASE);

    CacheLookup lookup = cacheOver(store).lookup(STORED_QUESTION);

    assertThat(lookup.entry().answer()).isEqualTo("first");
  }

  @Test
  void unreadable_and_incompatible_entries_are_skipped() throws Exception {
    CacheStore store = mock(CacheStore.class);
    when(store.scanKeys(properties.getKeyPrefix()))
        .thenReturn(List.of("k:corrupt", "k:short", "k:ok"));
    when(store.get("k:corrupt")).thenReturn(Optional.of("{not json"));
    when(store.get("k:short"))
        .thenReturn(Optional.of(json(entry("k:short", "short", new float[] {1, 0}, START))));
    when(store.get("k:ok")).thenReturn(Optional.of(json(entry("k:ok", "ok", BASE, START))));
    stubEmbedding(STORED_QUESTION, BASE);

    CacheLookup lookup = cacheOver(store).lookup(STORED_QUESTION);

    assertThat(lookup.entry().answer()).isEqualTo("ok");
  }

  // --- Expiry ---

  @Test
  void entry_past_ttl_is_a_miss_and_not_counted() {
    stubEmbedding(STORED_QUESTION, BASE);
    cache.store(STORED_QUESTION, "answer", 3);

    clock.advance(properties.getTtl());

    assertThat(cache.lookup(STORED_QUESTION).isHit()).isFalse();
    assertThat(cache.stats().entryCount()).isZero();
  }

  @Test
  void entry_past_ttl_is_ignored_even_if_store_still_holds_it() throws Exception {
    CacheStore store = mock(CacheStore.class);
    Instant created = START.minus(Duration.ofHours(25));
    when(store.scanKeys(properties.getKeyPrefix())).thenReturn(List.of("k:old"));
    when(store.get("k:old")).thenReturn(Optional.of(json(entry("k:old", "old", BASE, created))));
    stubEmbedding(STORED_QUESTION, BASE);

    SemanticResultCache neverEvicting = cacheOver(store);

    assertThat(neverEvicting.lookup(STORED_QUESTION).isHit()).isFalse();
    assertThat(neverEvicting.stats().entryCount()).isZero();
  }

  // --- Store, clear, stats ---

  @Test
  void storing_same_normalised_question_replaces_entry() {
    stubEmbedding(STORED_QUESTION, BASE);
    stubEmbedding("  is the STAFF friendly?", BASE);
    cache.store(STORED_QUESTION, "old answer", 1);
    cache.store("  is the STAFF friendly?", "new answer", 2);

    assertThat(cache.stats().entryCount()).isEqualTo(1);
    assertThat(cache.lookup(STORED_QUESTION).entry().answer()).isEqualTo("new answer");
  }

  @Test
  void clear_then_stats_reports_zero_entries() {
    stubEmbedding(STORED_QUESTION, BASE);
    stubEmbedding(SIMILAR_QUESTION, AT_THRESHOLD);
    cache.store(STORED_QUESTION, "a", 1);
    cache.store(SIMILAR_QUESTION, "b", 1);

    cache.clear();

    CacheStats stats = cache.stats();
    assertThat(stats.entryCount()).isZero();
    assertThat(stats.oldestEntry()).isNull();
    assertThat(stats.newestEntry()).isNull();
  }

  @Test
  void clear_on_empty_cache_is_harmless() {
    assertThatCode(() -> cache.clear()).doesNotThrowAnyException();
    assertThat(cache.stats().entryCount()).isZero();
  }

  @Test
  void stats_reports_age_bounds_and_configuration() {
    stubEmbedding(STORED_QUESTION, BASE);
    stubEmbedding(SIMILAR_QUESTION, AT_THRESHOLD);
    cache.store(STORED_QUESTION, "a", 1);
    clock.advance(Duration.ofMinutes(10));
    cache.store(SIMILAR_QUESTION, "b", 1);

    CacheStats stats = cache.stats();

    assertThat(stats.entryCount()).isEqualTo(2);
    assertThat(stats.oldestEntry()).isEqualTo(START);
    assertThat(stats.newestEntry()).isEqualTo(START.plus(Duration.ofMinutes(10)));
    assertThat(stats.similarityThreshold()).isEqualTo(0.95);
    assertThat(stats.ttl()).isEqualTo(Duration.ofHours(24));
  }

  @Test
  void store_reuses_embedding_from_preceding_lookup() {
    stubEmbedding(STORED_QUESTION, BASE);

    CacheLookup miss = cache.lookup(STORED_QUESTION);
    cache.store(STORED_QUESTION, "answer", 2, miss.questionEmbedding());

    assertThat(miss.questionEmbedding()).isNotNull();
    assertThat(cache.lookup(STORED_QUESTION).isHit()).isTrue();
    verify(embeddingModel, times(2)).embed(STORED_QUESTION);
  }

  // --- Store failures ---

  @Test
  void unreachable_store_turns_lookup_into_miss() {
    CacheStore store = mock(CacheStore.class);
    when(store.scanKeys(anyString()))
        .thenThrow(new CacheStoreException("down", new RuntimeException()));
    stubEmbedding(STORED_QUESTION, BASE);

    CacheLookup lookup = cacheOver(store).lookup(STORED_QUESTION);

    assertThat(lookup.isHit()).isFalse();
  }

  @Test
  void failed_write_is_not_propagated() {
    CacheStore store = mock(CacheStore.class);
    doThrow(new CacheStoreException("down", new RuntimeException()))
        .when(store)
        .put(anyString(), anyString(), any());
    stubEmbedding(STORED_QUESTION, BASE);

    assertThatCode(() -> cacheOver(store).store(STORED_QUESTION, "answer", 1))
        .doesNotThrowAnyException();
  }

  @Test
  void unreachable_store_reports_empty_stats() {
    CacheStore store = mock(CacheStore.class);
    when(store.scanKeys(anyString()))
        .thenThrow(new CacheStoreException("down", new RuntimeException()));

    CacheStats stats = cacheOver(store).stats();

    assertThat(stats.entryCount()).isZero();
    assertThat(stats.similarityThreshold()).isEqualTo(0.95);
  }

  @Test
  void embedding_failure_turns_lookup_into_miss() {
    when(embeddingModel.embed(anyString())).thenThrow(new IllegalStateException("model"));

    assertThat(cache.lookup(STORED_QUESTION).isHit()).isFalse();
  }

  private static CacheEntry entry(String key, String answer, float[] embedding, Instant created) {
    return new CacheEntry(key, "question " + key, embedding, answer, 1, created);
  }
}
