package io.mrimate.parrec.header;

/*
 * Copyright (c) mrimate
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.mrimate.parrec.errors.MalformedRecordException;
import io.mrimate.parrec.errors.ParRecException;
import io.mrimate.parrec.errors.UnsupportedVersionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Reads the text of a PAR header into a {@link RawHeader}.
///
/// Lines are consumed one at a time and fall into three classes:
/// - comment lines, starting with {@code #}, are ignored except for the one declaring the
///   format version, e.g. {@code # CLINICAL TRYOUT   Research image export tool   V4.2}
/// - general information lines, {@code .    Repetition time [ms]   :   5.000}
/// - image information rows, which follow the {@code === IMAGE INFORMATION ===} marker and hold a
///   fixed number of whitespace-separated columns for the declared version
///
/// No domain validation happens here. A row with the wrong column count is recorded as a
/// {@link MalformedRecordException}, its tokens are kept aside, and parsing carries on with the
/// next line.
public class HeaderParser {
  private static final Logger logger = LogManager.getLogger(HeaderParser.class);

  private static final Pattern VERSION_PATTERN =
      Pattern.compile("image export tool\\s+(V\\S+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern IMAGE_SECTION_PATTERN =
      Pattern.compile("^#\\s*=+\\s*IMAGE INFORMATION\\s*=+", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /// Parse a header file. PAR files are not always valid UTF-8, so the file is read as ISO-8859-1.
  /// @param parFile
  ///     the header to read
  /// @return the raw header
  /// @throws UnsupportedVersionException
  ///     if no supported version is declared
  /// @throws ParRecException
  ///     if the file cannot be read
  public RawHeader parse(Path parFile) {
    try (BufferedReader reader = Files.newBufferedReader(parFile, StandardCharsets.ISO_8859_1)) {
      return parse(reader);
    } catch (IOException e) {
      throw new ParRecException("unable to read header " + parFile, e);
    }
  }

  /// Parse header text held in memory
  /// @param text
  ///     the header content
  /// @return the raw header
  public RawHeader parse(String text) {
    try (BufferedReader reader = new BufferedReader(new StringReader(text))) {
      return parse(reader);
    } catch (IOException e) {
      throw new ParRecException("unable to read header text", e);
    }
  }

  /// Parse header text from a reader. The reader is consumed but not closed.
  /// @param source
  ///     the header content
  /// @return the raw header
  /// @throws IOException
  ///     if the reader fails
  public RawHeader parse(Reader source) throws IOException {
    BufferedReader reader =
        source instanceof BufferedReader br ? br : new BufferedReader(source);

    String declaredVersion = null;
    HeaderVersion version = null;
    boolean inImageSection = false;
    List<GeneralEntry> entries = new ArrayList<>();
    List<RawRecordRow> rows = new ArrayList<>();
    List<MalformedRecordException> malformed = new ArrayList<>();
    List<RawRecordRow> skipped = new ArrayList<>();

    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      if (trimmed.startsWith("#")) {
        if (declaredVersion == null) {
          Matcher m = VERSION_PATTERN.matcher(trimmed);
          if (m.find()) {
            declaredVersion = m.group(1);
            version = HeaderVersion.fromDeclared(declaredVersion);
            logger.debug("header declares version {} on line {}", version, lineNumber);
          }
        }
        if (IMAGE_SECTION_PATTERN.matcher(trimmed).find()) {
          inImageSection = true;
        }
        continue;
      }
      if (trimmed.startsWith(".")) {
        entries.add(parseGeneralEntry(trimmed, lineNumber));
        continue;
      }
      if (!inImageSection) {
        logger.debug("ignoring unclassified line {} outside the image section: {}", lineNumber,
            trimmed);
        continue;
      }
      if (version == null) {
        throw new UnsupportedVersionException(null);
      }

      List<RawValue> columns = tokenize(trimmed);
      if (columns.size() != version.columnCount()) {
        MalformedRecordException e =
            new MalformedRecordException(lineNumber, line, version.columnCount(), columns.size());
        logger.warn("skipping malformed image row: {}", e.getMessage());
        malformed.add(e);
        skipped.add(new RawRecordRow(lineNumber, columns, line));
        continue;
      }
      rows.add(new RawRecordRow(lineNumber, columns, line));
    }

    if (version == null) {
      throw new UnsupportedVersionException(null);
    }
    logger.debug("parsed {} general entries, {} image rows, {} malformed rows", entries.size(),
        rows.size(), malformed.size());
    return new RawHeader(version, entries, rows, malformed, skipped);
  }

  private GeneralEntry parseGeneralEntry(String trimmed, int lineNumber) {
    String body = trimmed.substring(1);
    int colon = body.indexOf(':');
    if (colon < 0) {
      return new GeneralEntry(body.trim(), List.of(), lineNumber);
    }
    String key = body.substring(0, colon).trim();
    String value = body.substring(colon + 1).trim();
    return new GeneralEntry(key, tokenize(value), lineNumber);
  }

  private static List<RawValue> tokenize(String text) {
    List<RawValue> tokens = new ArrayList<>();
    if (text.isEmpty()) {
      return tokens;
    }
    for (String token : WHITESPACE.split(text)) {
      if (!token.isEmpty()) {
        tokens.add(RawValue.of(token));
      }
    }
    return tokens;
  }
}
