/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.tradepost.api.CategoryHandle;
import dev.tradepost.api.EconomyException;
import dev.tradepost.api.ErrorCode;
import dev.tradepost.api.ItemDefinition;
import dev.tradepost.api.ItemHandle;
import dev.tradepost.api.ItemView;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

final class CatalogRegistryTest {
  private final CatalogRegistry registry = new CatalogRegistry();

  @Test
  void registersWeaponsAndResolvesByKey() {
    CategoryHandle weapons = registry.registerCategory("weapons", "Weapons", "guns");
    ItemHandle ak47 = registry.registerItem(weapons, "ak47", "AK-47", 1500);

    assertEquals(Optional.of(weapons), registry.lookupCategory("weapons"));
    assertEquals(Optional.of(ak47), registry.lookupByKey("weapons", "ak47"));
    ItemView view = registry.item(ak47).orElseThrow();
    assertEquals(1500, view.price());
    assertEquals("weapons", view.categoryKey());
    assertFalse(view.sellable());
    assertEquals(List.of(ak47), registry.category(weapons).orElseThrow().items());
    assertTrue(registry.purchasable(ak47));
  }

  @Test
  void keysAreCaseSensitive() {
    registry.registerCategory("weapons", "Weapons", "");
    CategoryHandle upper = registry.registerCategory("Weapons", "Weapons", "");

    assertEquals(Optional.of(upper), registry.lookupCategory("Weapons"));
    assertTrue(registry.lookupCategory("WEAPONS").isEmpty());
  }

  @Test
  void duplicateCategoryIsRejected() {
    registry.registerCategory("weapons", "Weapons", "");

    EconomyException e =
        assertThrows(
            EconomyException.class, () -> registry.registerCategory("weapons", "Again", ""));
    assertEquals(ErrorCode.DUPLICATE_KEY, e.errorCode());
    assertEquals(1, registry.categories().size());
  }

  @Test
  void sameItemKeyAllowedInDifferentCategories() {
    CategoryHandle a = registry.registerCategory("a", "A", "");
    CategoryHandle b = registry.registerCategory("b", "B", "");
    ItemHandle inA = registry.registerItem(a, "hat", "Hat", 10);
    ItemHandle inB = registry.registerItem(b, "hat", "Hat", 20);

    assertNotEquals(inA, inB);
    EconomyException dup =
        assertThrows(EconomyException.class, () -> registry.registerItem(a, "hat", "Hat", 5));
    assertEquals(ErrorCode.DUPLICATE_KEY, dup.errorCode());
  }

  @Test
  void invalidArgumentsLeaveNothingBehind() {
    CategoryHandle c = registry.registerCategory("c", "C", "");

    assertEquals(
        ErrorCode.INVALID_ARGUMENT,
        assertThrows(EconomyException.class, () -> registry.registerItem(c, "x", "X", -1))
            .errorCode());
    assertEquals(
        ErrorCode.INVALID_ARGUMENT,
        assertThrows(EconomyException.class, () -> registry.registerCategory(" ", "n", ""))
            .errorCode());
    assertEquals(
        ErrorCode.INVALID_ARGUMENT,
        assertThrows(
                EconomyException.class,
                () -> registry.registerItem(c, ItemDefinition.of("y").price(5).sellPrice(6)))
            .errorCode());
    assertEquals(
        ErrorCode.INVALID_ARGUMENT,
        assertThrows(
                EconomyException.class,
                () -> registry.registerCategory("k".repeat(65), "too long", ""))
            .errorCode());

    assertTrue(registry.items(c).isEmpty());
    assertTrue(registry.lookupByKey("c", "x").isEmpty());
  }

  @Test
  void unknownCategoryHandleIsInvalidCategory() {
    EconomyException e =
        assertThrows(
            EconomyException.class,
            () -> registry.registerItem(new CategoryHandle(99), "x", "X", 1));
    assertEquals(ErrorCode.INVALID_CATEGORY, e.errorCode());
  }

  @Test
  void definitionIsSealedAfterRegistration() {
    CategoryHandle c = registry.registerCategory("c", "C", "");
    ItemDefinition def = ItemDefinition.of("pass").price(100).sellPrice(40).durationSeconds(60);

    ItemHandle h = registry.registerItem(c, def);

    assertTrue(def.sealed());
    assertThrows(IllegalStateException.class, () -> def.price(1));
    assertEquals(
        ErrorCode.INVALID_ARGUMENT,
        assertThrows(EconomyException.class, () -> registry.registerItem(c, def)).errorCode());
    ItemView view = registry.item(h).orElseThrow();
    assertEquals(40, view.sellPrice());
    assertEquals(60, view.durationSeconds());
  }

  @Test
  void draftIsReadOnceSoLaterEditsCannotSkipValidation() {
    CategoryHandle weapons = registry.registerCategory("weapons", "Weapons", "");
    ItemDefinition draft = mock(ItemDefinition.class);
    when(draft.key()).thenReturn("ak47", "ak48");
    when(draft.name()).thenReturn("AK-47", "");
    when(draft.price()).thenReturn(1500L, -5L);
    when(draft.sellPrice()).thenReturn(-1L, 9_999L);
    when(draft.typeTag()).thenReturn("rifle");
    when(draft.durationSeconds()).thenReturn(0L, -1L);

    ItemHandle handle = registry.registerItem(weapons, draft);

    ItemView view = registry.item(handle).orElseThrow();
    assertEquals("ak47", view.key());
    assertEquals("AK-47", view.name());
    assertEquals(1500, view.price());
    assertFalse(view.sellable());
    assertEquals(0, view.durationSeconds());
    assertEquals(Optional.of(handle), registry.lookupByKey("weapons", "ak47"));
    verify(draft).seal();
  }

  @Test
  void deactivationKeepsHandlesResolving() {
    CategoryHandle c = registry.registerCategory("c", "C", "");
    ItemHandle h = registry.registerItem(c, "x", "X", 5);

    registry.deactivateCategory(c);

    assertFalse(registry.purchasable(h));
    assertTrue(registry.item(h).orElseThrow().active());
    assertFalse(registry.category(c).orElseThrow().active());
    assertEquals(Optional.of(h), registry.lookupByKey("c", "x"));
    assertEquals(
        ErrorCode.INVALID_CATEGORY,
        assertThrows(EconomyException.class, () -> registry.registerItem(c, "y", "Y", 1))
            .errorCode());
    assertEquals(
        ErrorCode.DUPLICATE_KEY,
        assertThrows(EconomyException.class, () -> registry.registerCategory("c", "C", ""))
            .errorCode());
  }

  @Test
  void handlesAreNeverReused() {
    CategoryHandle c = registry.registerCategory("c", "C", "");
    ItemHandle first = registry.registerItem(c, "x", "X", 5);
    registry.deactivateItem(first);
    ItemHandle second = registry.registerItem(c, "y", "Y", 5);

    assertNotEquals(first, second);
    assertEquals("x", registry.item(first).orElseThrow().key());
    assertFalse(registry.purchasable(first));
  }

  @Test
  void priceChangesAreVisibleThroughExistingHandles() {
    CategoryHandle c = registry.registerCategory("c", "C", "");
    ItemHandle h = registry.registerItem(c, ItemDefinition.of("x").price(100).sellPrice(50));

    registry.setPrice(h, 80);
    registry.setName(h, "Renamed");

    ItemView view = registry.item(h).orElseThrow();
    assertEquals(80, view.price());
    assertEquals("Renamed", view.name());
    assertEquals(
        ErrorCode.INVALID_ARGUMENT,
        assertThrows(EconomyException.class, () -> registry.setPrice(h, 40)).errorCode());
    assertEquals(
        ErrorCode.NOT_FOUND,
        assertThrows(EconomyException.class, () -> registry.setPrice(new ItemHandle(42), 1))
            .errorCode());
  }

  @Test
  void enumerationFollowsRegistrationOrder() {
    CategoryHandle z = registry.registerCategory("z", "Z", "");
    CategoryHandle a = registry.registerCategory("a", "A", "");
    ItemHandle second = registry.registerItem(z, "second", "S", 1);
    ItemHandle first = registry.registerItem(z, "first", "F", 1);

    assertEquals(List.of(z, a), registry.categories().stream().map(v -> v.handle()).toList());
    assertEquals(
        List.of(second, first), registry.items(z).stream().map(ItemView::handle).toList());
    assertTrue(registry.items(new CategoryHandle(77)).isEmpty());
  }
}
