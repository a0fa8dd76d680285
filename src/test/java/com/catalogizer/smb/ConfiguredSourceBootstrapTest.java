package com.catalogizer.smb;

import com.catalogizer.core.manager.ResilientSourceManager;
import com.catalogizer.core.source.DuplicateSourceException;
import com.catalogizer.core.source.Source;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ConfiguredSourceBootstrapTest {

    private static ResilienceProperties.SourceDefinition definition(String id, String path) {
        var definition = new ResilienceProperties.SourceDefinition();
        definition.setId(id);
        definition.setName(id);
        definition.setPath(path);
        return definition;
    }

    @Test
    @DisplayName("registers configured sources then starts the manager")
    void registersAndStarts() {
        var manager = mock(ResilientSourceManager.class);
        var props = new ResilienceProperties();
        props.setSources(List.of(
                definition("nas", "smb://nas.local/media"),
                definition("blank", " "),
                definition("backup", "smb://backup.local/share")));

        new ConfiguredSourceBootstrap(manager, props).init();

        var order = inOrder(manager);
        order.verify(manager, times(2)).addSource(any(Source.class));
        order.verify(manager).start();
    }

    @Test
    @DisplayName("a duplicate id does not stop startup")
    void duplicateSkipped() {
        var manager = mock(ResilientSourceManager.class);
        when(manager.addSource(any(Source.class)))
                .thenThrow(new DuplicateSourceException("nas"))
                .thenReturn("backup");
        var props = new ResilienceProperties();
        props.setSources(List.of(definition("nas", "smb://a/x"), definition("backup", "smb://b/y")));

        assertDoesNotThrow(() -> new ConfiguredSourceBootstrap(manager, props).init());
        verify(manager).start();
    }

    @Test
    @DisplayName("copies credentials and tunables onto the source")
    void toSource() {
        var definition = definition("nas", "smb://nas.local/media");
        definition.setUsername("catalog");
        definition.setPassword("secret");
        definition.setDomain("WORKGROUP");
        definition.setMaxRetryAttempts(2);
        definition.setRetryDelay(Duration.ofSeconds(5));

        Source source = ConfiguredSourceBootstrap.toSource(definition);

        assertEquals("nas", source.getId());
        assertEquals("catalog", source.endpoint().username());
        assertEquals("WORKGROUP", source.endpoint().domain());
        assertEquals(2, source.getMaxRetryAttempts());
        assertEquals(Duration.ofSeconds(5), source.getRetryDelay());
        assertNull(source.getConnectionTimeout());
    }
}
