package dev.reviewlens.review;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Loads reviews from a CSV export with the columns {@code Review_ID, Rating, Year_Month,
 * Reviewer_Location, Review_Text, Branch}.
 *
 * <p>The public review dumps are not consistently UTF-8, so the file is decoded strictly as UTF-8
 * first and re-decoded as ISO-8859-1 on a malformed byte sequence. A leading byte-order mark is
 * dropped. Rows without an id or without text are skipped; a header without the id or text column
 * is rejected.
 */
public class ReviewCsvLoader {

  private static final Logger log = LoggerFactory.getLogger(ReviewCsvLoader.class);

  static final String COLUMN_ID = "Review_ID";
  static final String COLUMN_RATING = "Rating";
  static final String COLUMN_YEAR_MONTH = "Year_Month";
  static final String COLUMN_LOCATION = "Reviewer_Location";
  static final String COLUMN_TEXT = "Review_Text";
  static final String COLUMN_BRANCH = "Branch";

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final CsvMapper csvMapper = new CsvMapper();

  /**
   * Reads every review from the given resource.
   *
   * @param resource the CSV resource
   * @return reviews in file order
   * @throws ReviewLoadException if the resource cannot be read or parsed
   */
  public List<Review> load(Resource resource) {
    log.info("Loading reviews from {}", resource.getDescription());
    try (InputStream in = resource.getInputStream()) {
      List<Review> reviews = parse(decode(in.readAllBytes()));
      log.info("Loaded {} reviews from {}", reviews.size(), resource.getDescription());
      return reviews;
    } catch (IOException e) {
      throw new ReviewLoadException("Unable to read reviews from " + resource.getDescription(), e);
    }
  }

  /**
   * Decodes raw bytes as UTF-8, falling back to ISO-8859-1 when the input is not valid UTF-8.
   *
   * @param bytes the raw file content
   * @return the decoded text without a leading byte-order mark
   */
  static String decode(byte[] bytes) {
    String text;
    try {
      text =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString();
    } catch (CharacterCodingException e) {
      log.debug("Review source is not valid UTF-8, decoding as ISO-8859-1");
      text = new String(bytes, StandardCharsets.ISO_8859_1);
    }
    if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
      return text.substring(1);
    }
    return text;
  }

  List<Review> parse(String csv) throws IOException {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<Review> reviews = new ArrayList<>();
    try (MappingIterator<Map<String, String>> rows =
        csvMapper.readerForMapOf(String.class).with(schema).readValues(csv)) {
      requireColumns(rows);
      while (rows.hasNext()) {
        Map<String, String> row = rows.next();
        String id = blankToNull(row.get(COLUMN_ID));
        String text = blankToNull(row.get(COLUMN_TEXT));
        if (id == null || text == null) {
          log.debug("Skipping review row without id or text: {}", row);
          continue;
        }
        reviews.add(
            new Review(
                id,
                blankToNull(row.get(COLUMN_BRANCH)),
                blankToNull(row.get(COLUMN_LOCATION)),
                blankToNull(row.get(COLUMN_RATING)),
                blankToNull(row.get(COLUMN_YEAR_MONTH)),
                text));
      }
    }
    return reviews;
  }

  private static void requireColumns(MappingIterator<Map<String, String>> rows) {
    if (!(rows.getParserSchema() instanceof CsvSchema header) || header.size() == 0) {
      return;
    }
    for (String required : List.of(COLUMN_ID, COLUMN_TEXT)) {
      if (header.column(required) == null) {
        throw new ReviewLoadException(
            "Review CSV header is missing column '" + required + "': " + header.getColumnDesc());
      }
    }
  }

  private static @Nullable String blankToNull(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
