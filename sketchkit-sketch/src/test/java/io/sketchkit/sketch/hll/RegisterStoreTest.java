package io.sketchkit.sketch.hll;

import org.junit.Test;

import java.util.PrimitiveIterator;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class RegisterStoreTest
{
  @Test
  public void testPackedSize()
  {
    assertEquals(12, RegisterStore.packedSize(4));
    assertEquals(3072, RegisterStore.packedSize(12));
    assertEquals(196608, RegisterStore.packedSize(18));
    assertEquals(12, new RegisterStore(4).memoryFootprint());
  }

  @Test
  public void testNewStoreIsEmpty()
  {
    RegisterStore store = new RegisterStore(8);
    assertEquals(256, store.size());
    assertTrue(store.isEmpty());
    for (int i = 0; i < store.size(); i++) {
      assertEquals(0, store.get(i));
    }
  }

  @Test
  public void testObserveKeepsMaximum()
  {
    RegisterStore store = new RegisterStore(4);
    assertTrue(store.observe(3, 5));
    assertFalse(store.observe(3, 2));
    assertFalse(store.observe(3, 5));
    assertEquals(5, store.get(3));
    assertTrue(store.observe(3, 63));
    assertEquals(63, store.get(3));
    assertFalse(store.isEmpty());
    for (int i = 0; i < store.size(); i++) {
      assertEquals(i == 3 ? 63 : 0, store.get(i));
    }
  }

  @Test
  public void testFieldsDoNotOverlap()
  {
    // every register sits at a different bit offset modulo 8, including the ones straddling bytes
    for (int p = 4; p <= 10; p++) {
      RegisterStore store = new RegisterStore(p);
      int[] expected = new int[store.size()];
      Random random = new Random(p);
      for (int i = 0; i < expected.length; i++) {
        expected[i] = random.nextInt(RegisterStore.MAX_REGISTER_VALUE + 1);
        store.observe(i, expected[i]);
      }
      for (int i = 0; i < expected.length; i++) {
        assertEquals("register " + i, expected[i], store.get(i));
      }
    }
  }

  @Test
  public void testMaxValueNextToZeros()
  {
    RegisterStore store = new RegisterStore(4);
    for (int i = 0; i < store.size(); i += 2) {
      store.observe(i, RegisterStore.MAX_REGISTER_VALUE);
    }
    for (int i = 0; i < store.size(); i++) {
      assertEquals(i % 2 == 0 ? RegisterStore.MAX_REGISTER_VALUE : 0, store.get(i));
    }
  }

  @Test
  public void testBitLayout()
  {
    RegisterStore store = new RegisterStore(4);
    store.observe(0, 0b000001);
    store.observe(1, 0b111111);
    byte[] bytes = store.toByteArray();
    assertEquals((byte) 0b1100_0001, bytes[0]);
    assertEquals((byte) 0b0000_1111, bytes[1]);
    assertEquals(0, bytes[2]);
  }

  @Test
  public void testIteratorIsRestartable()
  {
    RegisterStore store = new RegisterStore(4);
    store.observe(0, 7);
    store.observe(15, 9);

    for (int pass = 0; pass < 2; pass++) {
      PrimitiveIterator.OfInt it = store.iterator();
      int count = 0;
      int sum = 0;
      while (it.hasNext()) {
        sum += it.nextInt();
        count++;
      }
      assertEquals(16, count);
      assertEquals(16, sum);
    }
  }

  @Test
  public void testPackedBytesRoundTrip()
  {
    RegisterStore store = new RegisterStore(6);
    store.observe(10, 17);
    store.observe(63, 42);

    byte[] bytes = store.toByteArray();
    RegisterStore restored = RegisterStore.fromPackedBytes(6, bytes);
    assertEquals(store, restored);
    assertEquals(store.hashCode(), restored.hashCode());

    // the store owns its buffer
    bytes[0] = (byte) 0xff;
    assertEquals(0, restored.get(0));
  }

  @Test
  public void testCopyIsIndependent()
  {
    RegisterStore store = new RegisterStore(5);
    store.observe(1, 3);
    RegisterStore copy = store.copy();
    copy.observe(2, 4);
    assertEquals(0, store.get(2));
    assertNotEquals(store, copy);
    assertArrayEquals(store.toByteArray(), RegisterStore.fromPackedBytes(5, store.toByteArray()).toByteArray());
  }

  @Test
  public void testClear()
  {
    RegisterStore store = new RegisterStore(6);
    for (int i = 0; i < store.size(); i++) {
      store.observe(i, i % (RegisterStore.MAX_REGISTER_VALUE + 1));
    }
    store.clear();
    assertTrue(store.isEmpty());
    assertEquals(new RegisterStore(6), store);
    assertTrue(store.observe(5, 1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsWrongBufferLength()
  {
    RegisterStore.fromPackedBytes(4, new byte[11]);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testRejectsIndexPastEnd()
  {
    new RegisterStore(4).get(16);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRejectsOversizedValue()
  {
    new RegisterStore(4).observe(0, 64);
  }
}
