/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 */

package io.github.pumpprobe.util.io.npy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class NpyFormatTest {

  private static byte[] npyV1(String header, byte[] data) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(new byte[]{(byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 1, 0});
    final byte[] h = header.getBytes(StandardCharsets.ISO_8859_1);
    out.write(h.length & 0xFF);
    out.write((h.length >> 8) & 0xFF);
    out.writeBytes(h);
    out.writeBytes(data);
    return out.toByteArray();
  }

  @Test
  void testWrittenHeaderIsAligned() throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    final NpyArray array = NpyArray.ofFloats(new float[]{1f, 2f, 3f, 4f, 5f, 6f}, 2, 3);
    NpyFormat.write(array, out);
    final byte[] bytes = out.toByteArray();
    Assertions.assertEquals(0, (bytes.length - 6 * 4) % 64);

    final NpyArray read = NpyFormat.read(new ByteArrayInputStream(bytes));
    Assertions.assertArrayEquals(new int[]{2, 3}, read.getShape());
    Assertions.assertEquals(NpyDataType.FLOAT32, read.getDataType());
    Assertions.assertEquals(6f, read.toFloatArray()[5]);
  }

  @Test
  void testReadsBigEndianInt16() throws IOException {
    final ByteBuffer data = ByteBuffer.allocate(6).order(ByteOrder.BIG_ENDIAN);
    data.putShort((short) 1).putShort((short) -2).putShort((short) 300);
    final byte[] bytes = npyV1("{'descr': '>i2', 'fortran_order': False, 'shape': (3,), }\n",
        data.array());

    final NpyArray read = NpyFormat.read(new ByteArrayInputStream(bytes));
    Assertions.assertEquals(NpyDataType.INT16, read.getDataType());
    Assertions.assertArrayEquals(new double[]{1d, -2d, 300d}, read.toDoubleArray());
    Assertions.assertArrayEquals(new long[]{1L, -2L, 300L}, read.toLongArray());
  }

  @Test
  void testReadsScalarShape() throws IOException {
    final byte[] data = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putDouble(2.5)
        .array();
    final byte[] bytes = npyV1("{'descr': '<f8', 'fortran_order': False, 'shape': (), }\n", data);
    final NpyArray read = NpyFormat.read(new ByteArrayInputStream(bytes));
    Assertions.assertEquals(0, read.getNumberOfDimensions());
    Assertions.assertEquals(1, read.getNumberOfElements());
    Assertions.assertEquals(2.5, read.getDouble(0));
  }

  @Test
  void testBooleanFlags() throws IOException {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    NpyFormat.write(NpyArray.ofBooleans(new boolean[]{true, false, true}, 3), out);
    final NpyArray read = NpyFormat.read(new ByteArrayInputStream(out.toByteArray()));
    Assertions.assertEquals(NpyDataType.BOOL, read.getDataType());
    Assertions.assertArrayEquals(new boolean[]{true, false, true}, read.toBooleanArray());
  }

  @Test
  void testRejectsBadMagic() {
    final byte[] bytes = "not a numpy file at all".getBytes(StandardCharsets.US_ASCII);
    Assertions.assertThrows(IOException.class,
        () -> NpyFormat.read(new ByteArrayInputStream(bytes)));
  }

  @Test
  void testRejectsCorruptVersionTwoHeaderLength() {
    final ByteBuffer buffer = ByteBuffer.allocate(12).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(new byte[]{(byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 2, 0});
    buffer.putInt(-16);
    final IOException e = Assertions.assertThrows(IOException.class,
        () -> NpyFormat.read(new ByteArrayInputStream(buffer.array())));
    Assertions.assertTrue(e.getMessage().contains("header length"));
  }

  @Test
  void testRejectsFortranOrder() {
    final byte[] bytes = npyV1("{'descr': '<f4', 'fortran_order': True, 'shape': (1,), }\n",
        new byte[4]);
    final IOException e = Assertions.assertThrows(IOException.class,
        () -> NpyFormat.read(new ByteArrayInputStream(bytes)));
    Assertions.assertTrue(e.getMessage().contains("Fortran"));
  }

  @Test
  void testRejectsUnsupportedType() {
    final byte[] bytes = npyV1("{'descr': '<c16', 'fortran_order': False, 'shape': (1,), }\n",
        new byte[16]);
    Assertions.assertThrows(IOException.class,
        () -> NpyFormat.read(new ByteArrayInputStream(bytes)));
  }

  @Test
  void testShapeMustMatchData() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> NpyArray.ofFloats(new float[5], 2, 3));
  }
}
