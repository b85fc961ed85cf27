package com.forecast.sync.mirror;

import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.MirrorRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CountCachingMirrorStoreTest {

    @Mock
    private MirrorStore delegate;

    private CountCachingMirrorStore store;
    private final MirrorFilter cranes = MirrorFilter.builder().category("Cranes").build();

    @BeforeEach
    void setUp() {
        store = new CountCachingMirrorStore(delegate, CountCacheConfig.defaults());
    }

    @Test
    @DisplayName("Repeated counts hit the delegate once")
    void testCachesCount() {
        when(delegate.count("org-1", cranes)).thenReturn(42L);

        assertEquals(42L, store.count("org-1", cranes));
        assertEquals(42L, store.count("org-1", cranes));

        verify(delegate, times(1)).count("org-1", cranes);
    }

    @Test
    @DisplayName("A write to the organization drops its cached counts")
    void testInvalidatesOnWrite() {
        when(delegate.count("org-1", cranes)).thenReturn(42L, 43L);
        when(delegate.promote(eq("org-1"), eq("PFA-9"), any()))
                .thenReturn(new MirrorRecord("m9", "org-1", "PFA-9", Document.empty(), 1, Instant.EPOCH));

        store.count("org-1", cranes);
        store.promote("org-1", "PFA-9", Document.empty());

        assertEquals(43L, store.count("org-1", cranes));
        verify(delegate, times(2)).count("org-1", cranes);
    }

    @Test
    @DisplayName("Other organizations keep their cached counts")
    void testOtherOrganizationsKept() {
        when(delegate.count("org-2", cranes)).thenReturn(7L);

        store.count("org-2", cranes);
        store.invalidate("org-1");
        store.count("org-2", cranes);

        verify(delegate, times(1)).count("org-2", cranes);
    }

    @Test
    @DisplayName("Should reject invalid cache configuration")
    void testInvalidConfig() {
        assertThrows(IllegalArgumentException.class, () -> new CountCacheConfig(0, 30, true));
    }
}
