/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.pumpprobe.util.io.npy;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.NotNull;

/**
 * Reader and writer for the NumPy .npy format (versions 1.0 to 3.0 on read, 1.0 on write). Only C
 * order arrays are supported.
 */
public final class NpyFormat {

  private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
  private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([<>|=])(\\w+)'");
  private static final Pattern FORTRAN = Pattern.compile("'fortran_order'\\s*:\\s*(True|False)");
  private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");
  private static final int ALIGNMENT = 64;

  private NpyFormat() {
  }

  public static @NotNull NpyArray read(@NotNull Path file) throws IOException {
    if (!Files.isRegularFile(file)) {
      throw new NoSuchFileException(file.toString());
    }
    try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
      return read(in);
    }
  }

  public static @NotNull NpyArray read(@NotNull InputStream stream) throws IOException {
    final DataInputStream in = new DataInputStream(stream);
    final byte[] magic = new byte[MAGIC.length];
    in.readFully(magic);
    if (!Arrays.equals(magic, MAGIC)) {
      throw new IOException("Not a npy stream (bad magic)");
    }
    final int major = in.readUnsignedByte();
    in.readUnsignedByte(); // minor version
    final int headerLength;
    if (major == 1) {
      final byte[] len = new byte[2];
      in.readFully(len);
      headerLength = ByteBuffer.wrap(len).order(ByteOrder.LITTLE_ENDIAN).getShort() & 0xFFFF;
    } else if (major == 2 || major == 3) {
      final byte[] len = new byte[4];
      in.readFully(len);
      headerLength = ByteBuffer.wrap(len).order(ByteOrder.LITTLE_ENDIAN).getInt();
    } else {
      throw new IOException("Unsupported npy version " + major);
    }
    if (headerLength < 0) {
      throw new IOException("Corrupt npy header length " + headerLength);
    }
    final byte[] headerBytes = new byte[headerLength];
    in.readFully(headerBytes);
    final String header = new String(headerBytes,
        major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);

    final Matcher descr = DESCR.matcher(header);
    final Matcher fortran = FORTRAN.matcher(header);
    final Matcher shapeMatcher = SHAPE.matcher(header);
    if (!descr.find() || !fortran.find() || !shapeMatcher.find()) {
      throw new IOException("Malformed npy header: " + header.trim());
    }
    if ("True".equals(fortran.group(1))) {
      throw new IOException("Fortran ordered npy arrays are not supported");
    }
    final NpyDataType type;
    try {
      type = NpyDataType.fromDescr(descr.group(2));
    } catch (IllegalArgumentException e) {
      throw new IOException(e.getMessage(), e);
    }
    final ByteOrder order = ">".equals(descr.group(1)) ? ByteOrder.BIG_ENDIAN
        : ByteOrder.LITTLE_ENDIAN;
    final int[] shape = parseShape(shapeMatcher.group(1));

    final long byteCount = NpyArray.elementCount(shape) * type.getSize();
    if (byteCount > Integer.MAX_VALUE - 8) {
      throw new IOException("npy array too large: " + Arrays.toString(shape));
    }
    final byte[] data = new byte[(int) byteCount];
    in.readFully(data);
    return new NpyArray(type, order, shape, data);
  }

  private static int[] parseShape(String shape) throws IOException {
    final String trimmed = shape.trim();
    if (trimmed.isEmpty()) {
      return new int[0];
    }
    try {
      return Arrays.stream(trimmed.split(",")).map(String::trim).filter(s -> !s.isEmpty())
          .map(s -> s.endsWith("L") ? s.substring(0, s.length() - 1) : s)
          .mapToInt(Integer::parseInt).toArray();
    } catch (NumberFormatException e) {
      throw new IOException("Malformed npy shape: (" + shape + ")", e);
    }
  }

  public static void write(@NotNull NpyArray array, @NotNull Path file) throws IOException {
    try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file))) {
      write(array, out);
    }
  }

  /**
   * Writes a version 1.0 npy stream. The stream is not closed.
   */
  public static void write(@NotNull NpyArray array, @NotNull OutputStream out) throws IOException {
    final int[] shape = array.getShape();
    final StringBuilder shapeText = new StringBuilder("(");
    for (int i = 0; i < shape.length; i++) {
      if (i > 0) {
        shapeText.append(", ");
      }
      shapeText.append(shape[i]);
    }
    if (shape.length == 1) {
      shapeText.append(',');
    }
    shapeText.append(')');

    final boolean little = array.getByteOrder() == ByteOrder.LITTLE_ENDIAN;
    final StringBuilder header = new StringBuilder();
    header.append("{'descr': '").append(array.getDataType().toDescr(little))
        .append("', 'fortran_order': False, 'shape': ").append(shapeText).append(", }");
    // magic(6) + version(2) + length(2) + header + '\n' must be a multiple of 64
    final int unpadded = MAGIC.length + 4 + header.length() + 1;
    final int padding = (ALIGNMENT - unpadded % ALIGNMENT) % ALIGNMENT;
    header.append(" ".repeat(padding)).append('\n');

    final byte[] headerBytes = header.toString().getBytes(StandardCharsets.ISO_8859_1);
    if (headerBytes.length > 0xFFFF) {
      throw new IOException("npy header too long");
    }
    out.write(MAGIC);
    out.write(1);
    out.write(0);
    out.write(headerBytes.length & 0xFF);
    out.write((headerBytes.length >> 8) & 0xFF);
    out.write(headerBytes);
    out.write(array.getRawData());
  }
}
