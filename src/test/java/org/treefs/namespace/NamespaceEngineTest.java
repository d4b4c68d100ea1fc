package org.treefs.namespace;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.treefs.namespace.dto.DirectoryEntry;
import org.treefs.namespace.dto.DirectoryListing;
import org.treefs.namespace.dto.NamespaceStats;
import org.treefs.namespace.dto.NodeInfo;
import org.treefs.namespace.dto.TreeEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamespaceEngineTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private NamespaceEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        engine = new NamespaceEngine("root", clock);
    }

    @Test
    void constructor_startsAtRoot() {
        assertThat(engine.getCurrentPath()).isEqualTo("/");
        assertThat(engine.getRoot().getParent()).isNull();
        assertThat(engine.getRoot().getName()).isEqualTo("root");
        assertThat(engine.getCurrentDirectory()).isSameAs(engine.getRoot());
    }

    @Test
    void constructor_blankRootNameFallsBackToDefault() {
        NamespaceEngine blank = new NamespaceEngine(" ", clock);

        assertThat(blank.getRoot().getName()).isEqualTo(NamespaceEngine.DEFAULT_ROOT_NAME);
    }

    @Test
    void createFile_thenFileInfoReportsEmptyFile() {
        engine.createFile("notes.txt");

        NodeInfo info = engine.fileInfo("notes.txt");
        assertThat(info.kind()).isEqualTo(NodeKind.FILE);
        assertThat(info.sizeBytes()).isZero();
        assertThat(info.path()).isEqualTo("/notes.txt");
        assertThat(info.createdAt()).isEqualTo(T0);
        assertThat(info.modifiedAt()).isEqualTo(T0);
        assertThat(engine.readFile("notes.txt")).isEmpty();
    }

    @Test
    void createFile_withInitialContent() {
        engine.createFile("data.txt", "hello");

        assertThat(engine.readFile("data.txt")).isEqualTo("hello");
        assertThat(engine.fileInfo("data.txt").sizeBytes()).isEqualTo(5);
    }

    @Test
    void createFile_duplicateFails() {
        engine.createFile("test.txt");

        assertThatThrownBy(() -> engine.createFile("test.txt"))
                .isInstanceOf(AlreadyExistsException.class)
                .hasMessageContaining("test.txt")
                .extracting(e -> ((NamespaceException) e).getError())
                .isEqualTo(NamespaceError.ALREADY_EXISTS);
    }

    @Test
    void createFile_clashesWithDirectoryOfSameName() {
        engine.createDirectory("shared");

        assertThatThrownBy(() -> engine.createFile("shared"))
                .isInstanceOf(AlreadyExistsException.class);
        assertThat(engine.fileInfo("shared").kind()).isEqualTo(NodeKind.DIRECTORY);
    }

    @Test
    void createFile_invalidNamesFail() {
        assertThatThrownBy(() -> engine.createFile(""))
                .isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> engine.createFile("a/b"))
                .isInstanceOf(InvalidNameException.class)
                .hasMessageContaining("a/b");
        assertThatThrownBy(() -> engine.createFile(null))
                .isInstanceOf(InvalidNameException.class);
        assertThat(engine.listDirectory().empty()).isTrue();
    }

    @Test
    void createFile_acceptsSpacesAndUnderscores() {
        engine.createFile("my file.txt");
        engine.createFile("my_file.txt");

        assertThat(engine.listDirectory().entries())
                .extracting(DirectoryEntry::name)
                .containsExactly("my file.txt", "my_file.txt");
    }

    @Test
    void createDirectory_duplicateAndInvalidNamesFail() {
        engine.createDirectory("folder1");

        assertThatThrownBy(() -> engine.createDirectory("folder1"))
                .isInstanceOf(AlreadyExistsException.class);
        assertThatThrownBy(() -> engine.createDirectory(""))
                .isInstanceOf(InvalidNameException.class);
        assertThatThrownBy(() -> engine.createDirectory("x/y"))
                .isInstanceOf(InvalidNameException.class);
    }

    @Test
    void namesAreCaseSensitive() {
        engine.createFile("Report");
        engine.createFile("report");

        assertThat(engine.listDirectory().entries()).hasSize(2);
    }

    @Test
    void changeDirectory_buildsNestedPath() {
        engine.createDirectory("a");
        engine.changeDirectory("a");
        engine.createDirectory("b");
        engine.changeDirectory("b");

        assertThat(engine.getCurrentPath()).isEqualTo("/a/b");

        engine.changeDirectory("..");
        assertThat(engine.getCurrentPath()).isEqualTo("/a");
        engine.changeDirectory("..");
        assertThat(engine.getCurrentPath()).isEqualTo("/");
    }

    @Test
    void changeDirectory_parentAtRootFails() {
        assertThatThrownBy(() -> engine.changeDirectory(".."))
                .isInstanceOf(EntryNotFoundException.class)
                .extracting(e -> ((NamespaceException) e).getError())
                .isEqualTo(NamespaceError.DIRECTORY_NOT_FOUND);
        assertThat(engine.getCurrentPath()).isEqualTo("/");
    }

    @Test
    void changeDirectory_slashReturnsToRootFromAnyDepth() {
        engine.createDirectory("a");
        engine.changeDirectory("a");
        engine.createDirectory("b");
        engine.changeDirectory("b");

        engine.changeDirectory("/");

        assertThat(engine.getCurrentPath()).isEqualTo("/");
        engine.changeDirectory("/");
        assertThat(engine.getCurrentPath()).isEqualTo("/");
    }

    @Test
    void changeDirectory_missingOrFileTargetFails() {
        engine.createFile("plain.txt");

        assertThatThrownBy(() -> engine.changeDirectory("nowhere"))
                .isInstanceOf(EntryNotFoundException.class)
                .hasMessageContaining("nowhere");
        assertThatThrownBy(() -> engine.changeDirectory("plain.txt"))
                .isInstanceOf(EntryNotFoundException.class)
                .extracting(e -> ((NamespaceException) e).getError())
                .isEqualTo(NamespaceError.DIRECTORY_NOT_FOUND);
        assertThatThrownBy(() -> engine.changeDirectory("a/b"))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void writeFile_thenReadFileRoundTrips() {
        engine.createFile("doc.txt");
        clock.advance(Duration.ofSeconds(30));

        engine.writeFile("doc.txt", "line1\nline2\n");
        engine.writeFile("doc.txt", "line1\nline2\n");

        assertThat(engine.readFile("doc.txt")).isEqualTo("line1\nline2\n");
        NodeInfo info = engine.fileInfo("doc.txt");
        assertThat(info.sizeBytes()).isEqualTo(12);
        assertThat(info.createdAt()).isEqualTo(T0);
        assertThat(info.modifiedAt()).isEqualTo(T0.plusSeconds(30));
    }

    @Test
    void writeFile_allowsOverwriteAndEmptyContent() {
        engine.createFile("f", "first");

        engine.writeFile("f", "second");
        assertThat(engine.readFile("f")).isEqualTo("second");

        engine.writeFile("f", "");
        assertThat(engine.readFile("f")).isEmpty();
        assertThat(engine.fileInfo("f").sizeBytes()).isZero();
    }

    @Test
    void writeFile_missingOrDirectoryFails() {
        engine.createDirectory("dir");

        assertThatThrownBy(() -> engine.writeFile("missing", "x"))
                .isInstanceOf(EntryNotFoundException.class)
                .extracting(e -> ((NamespaceException) e).getError())
                .isEqualTo(NamespaceError.FILE_NOT_FOUND);
        assertThatThrownBy(() -> engine.writeFile("dir", "x"))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void readFile_missingOrDirectoryFails() {
        engine.createDirectory("dir");

        assertThatThrownBy(() -> engine.readFile("missing"))
                .isInstanceOf(EntryNotFoundException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> engine.readFile("dir"))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void readFile_onlySeesCurrentDirectory() {
        engine.createDirectory("sub");
        engine.changeDirectory("sub");
        engine.createFile("inner.txt", "x");
        engine.changeDirectory("..");

        assertThatThrownBy(() -> engine.readFile("inner.txt"))
                .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void deleteEntry_removesFileAndEmptyDirectory() {
        engine.createFile("gone.txt");
        engine.createDirectory("emptyDir");

        engine.deleteEntry("gone.txt");
        engine.deleteEntry("emptyDir");

        assertThatThrownBy(() -> engine.fileInfo("gone.txt"))
                .isInstanceOf(EntryNotFoundException.class);
        assertThatThrownBy(() -> engine.fileInfo("emptyDir"))
                .isInstanceOf(EntryNotFoundException.class);
        assertThat(engine.listDirectory().empty()).isTrue();
    }

    @Test
    void deleteEntry_nonEmptyDirectoryFailsWithoutChanges() {
        engine.createDirectory("full");
        engine.changeDirectory("full");
        engine.createFile("keep.txt");
        engine.changeDirectory("..");

        assertThatThrownBy(() -> engine.deleteEntry("full"))
                .isInstanceOf(NonEmptyDirectoryException.class)
                .hasMessageContaining("full")
                .extracting(e -> ((NamespaceException) e).getError())
                .isEqualTo(NamespaceError.DIRECTORY_NOT_EMPTY);

        engine.changeDirectory("full");
        assertThat(engine.readFile("keep.txt")).isEmpty();
    }

    @Test
    void deleteEntry_missingFails() {
        assertThatThrownBy(() -> engine.deleteEntry("ghost"))
                .isInstanceOf(EntryNotFoundException.class)
                .extracting(e -> ((NamespaceException) e).getError())
                .isEqualTo(NamespaceError.FILE_NOT_FOUND);
    }

    @Test
    void deleteEntry_nameCanBeReusedAfterDeletion() {
        engine.createDirectory("reuse");
        engine.deleteEntry("reuse");

        engine.createFile("reuse", "now a file");

        assertThat(engine.fileInfo("reuse").kind()).isEqualTo(NodeKind.FILE);
    }

    @Test
    void deleteEntry_cannotReachAncestorsOfCurrentDirectory() {
        engine.createDirectory("a");
        engine.changeDirectory("a");

        assertThatThrownBy(() -> engine.deleteEntry(".."))
                .isInstanceOf(EntryNotFoundException.class);
        assertThatThrownBy(() -> engine.deleteEntry("a"))
                .isInstanceOf(EntryNotFoundException.class);
        assertThat(engine.getCurrentPath()).isEqualTo("/a");
    }

    @Test
    void fileInfo_reportsDirectoryWithZeroSize() {
        engine.createDirectory("infoDir");

        NodeInfo info = engine.fileInfo("infoDir");

        assertThat(info.kind()).isEqualTo(NodeKind.DIRECTORY);
        assertThat(info.sizeBytes()).isZero();
        assertThat(info.path()).isEqualTo("/infoDir");
    }

    @Test
    void fileInfo_missingFails() {
        assertThatThrownBy(() -> engine.fileInfo("missing"))
                .isInstanceOf(EntryNotFoundException.class)
                .hasMessageContaining("missing");
    }

    @Test
    void listDirectory_usesInsertionOrderAndReportsSizeOnlyForNonEmptyFiles() {
        engine.createFile("zeta.txt", "abc");
        engine.createDirectory("alpha");
        engine.createFile("empty.txt");

        DirectoryListing listing = engine.listDirectory();

        assertThat(listing.path()).isEqualTo("/");
        assertThat(listing.empty()).isFalse();
        assertThat(listing.entries()).containsExactly(
                new DirectoryEntry("zeta.txt", NodeKind.FILE, 3L),
                new DirectoryEntry("alpha", NodeKind.DIRECTORY, null),
                new DirectoryEntry("empty.txt", NodeKind.FILE, null)
        );
    }

    @Test
    void listDirectory_canSortByName() {
        engine.createFile("b");
        engine.createFile("a");
        engine.createDirectory("c");

        assertThat(engine.listDirectory(true).entries())
                .extracting(DirectoryEntry::name)
                .containsExactly("a", "b", "c");
    }

    @Test
    void listDirectory_emptyDirectoryIsExplicit() {
        engine.createDirectory("nothing");
        engine.changeDirectory("nothing");

        DirectoryListing listing = engine.listDirectory();

        assertThat(listing.empty()).isTrue();
        assertThat(listing.entries()).isEmpty();
        assertThat(listing.path()).isEqualTo("/nothing");
    }

    @Test
    void displayStats_countsRootSubdirectoryAndFileBytes() {
        engine.createFile("five.txt", "12345");
        engine.createDirectory("sub");

        NamespaceStats stats = engine.displayStats();

        assertThat(stats).isEqualTo(new NamespaceStats(2, 1, 5));
    }

    @Test
    void displayStats_ignoresCurrentDirectory() {
        engine.createDirectory("a");
        engine.changeDirectory("a");
        engine.createFile("x", "xy");

        assertThat(engine.displayStats()).isEqualTo(new NamespaceStats(2, 1, 2));
    }

    @Test
    void searchFile_findsMatchesAcrossTheWholeTree() {
        engine.createFile("report.txt");
        engine.createFile("report2.txt");
        engine.createDirectory("docs");
        engine.changeDirectory("docs");
        engine.createFile("report3.txt");

        assertThat(engine.searchFile("report"))
                .containsExactly("/report.txt", "/report2.txt", "/docs/report3.txt");
    }

    @Test
    void searchFile_neverMatchesDirectoriesButDescendsIntoThem() {
        engine.createDirectory("report");
        engine.changeDirectory("report");
        engine.createFile("summary.txt");
        engine.changeDirectory("/");

        assertThat(engine.searchFile("report")).isEmpty();
        assertThat(engine.searchFile("summary")).containsExactly("/report/summary.txt");
    }

    @Test
    void searchFile_isCaseSensitive() {
        engine.createFile("Report.txt");

        assertThat(engine.searchFile("report")).isEmpty();
        assertThat(engine.searchFile("Report")).containsExactly("/Report.txt");
    }

    @Test
    void nestedOperationsRoundTripBackToRoot() {
        engine.createDirectory("a");
        engine.changeDirectory("a");
        engine.createDirectory("b");
        engine.changeDirectory("b");
        engine.createDirectory("c");
        engine.changeDirectory("c");
        assertThat(engine.getCurrentPath()).isEqualTo("/a/b/c");

        engine.createFile("deep.txt", "deep");
        assertThat(engine.fileInfo("deep.txt").path()).isEqualTo("/a/b/c/deep.txt");

        engine.changeDirectory("/");
        assertThat(engine.getCurrentPath()).isEqualTo("/");
        assertThat(engine.searchFile("deep")).containsExactly("/a/b/c/deep.txt");
    }

    @Test
    void traversals_handleTreesThousandsOfLevelsDeep() {
        int depth = 3_000;
        for (int i = 0; i < depth; i++) {
            engine.createDirectory("d");
            engine.changeDirectory("d");
        }
        engine.createFile("leaf.txt", "abc");
        String leafPath = "/d".repeat(depth) + "/leaf.txt";

        assertThat(engine.displayStats()).isEqualTo(new NamespaceStats(depth + 1, 1, 3));
        assertThat(engine.searchFile("leaf")).containsExactly(leafPath);

        List<TreeEntry> tree = engine.enumerateTree();
        assertThat(tree).hasSize(depth + 2);
        assertThat(tree.get(depth + 1).path()).isEqualTo(leafPath);
        assertThat(tree.get(depth + 1).depth()).isEqualTo(depth + 1);
        assertThat(tree.get(depth).current()).isTrue();
    }
}
