package io.b2mash.yahrzeit.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches year tables from a Hebcal-compatible converter endpoint. A table is derived from the
 * Gregorian dates of 1 Tishrei in the requested year and the year after; the converter is never
 * asked for anything the table cannot validate.
 */
public class RemoteDateTableSource implements DateTableSource {

  private static final Logger log = LoggerFactory.getLogger(RemoteDateTableSource.class);

  private final RestClient restClient;

  public RemoteDateTableSource(RestClient restClient) {
    this.restClient = restClient;
  }

  @Override
  public String sourceId() {
    return "remote";
  }

  @Override
  public HebrewYearTable lookup(int hebrewYear) {
    if (hebrewYear < UnsupportedDateRangeException.MIN_YEAR
        || hebrewYear > UnsupportedDateRangeException.MAX_YEAR) {
      throw UnsupportedDateRangeException.forHebrewYear(hebrewYear);
    }
    LocalDate newYear = fetchNewYear(hebrewYear);
    LocalDate following = fetchNewYear(hebrewYear + 1);
    int length = (int) ChronoUnit.DAYS.between(newYear, following);
    try {
      return new HebrewYearTable(hebrewYear, newYear, length);
    } catch (IllegalArgumentException e) {
      throw new DateComputationException(
          "Converter returned an invalid table for Hebrew year " + hebrewYear, e);
    }
  }

  private LocalDate fetchNewYear(int hebrewYear) {
    try {
      var response =
          restClient
              .get()
              .uri(
                  uri ->
                      uri.path("/converter")
                          .queryParam("cfg", "json")
                          .queryParam("hy", hebrewYear)
                          .queryParam("hm", "Tishrei")
                          .queryParam("hd", 1)
                          .queryParam("h2g", 1)
                          .build())
              .retrieve()
              .body(ConverterResponse.class);
      if (response == null) {
        throw new DateComputationException(
            "Empty converter response for 1 Tishrei " + hebrewYear, null);
      }
      log.debug(
          "Converter resolved 1 Tishrei {} to {}-{}-{}",
          hebrewYear,
          response.gy(),
          response.gm(),
          response.gd());
      return LocalDate.of(response.gy(), response.gm(), response.gd());
    } catch (RestClientException | DateTimeException e) {
      throw new DateComputationException(
          "Converter lookup failed for Hebrew year " + hebrewYear + ": " + e.getMessage(), e);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ConverterResponse(int gy, int gm, int gd) {}
}
