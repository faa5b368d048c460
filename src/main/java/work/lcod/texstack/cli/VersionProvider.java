package work.lcod.texstack.cli;

import java.util.Arrays;
import java.util.stream.Collectors;
import picocli.CommandLine;
import work.lcod.texstack.item.ItemKind;

/**
 * Reports the build version and the item kinds a script may use.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        String kinds = Arrays.stream(ItemKind.values()).map(ItemKind::tag).collect(Collectors.joining(", "));
        return new String[] { "texstack-run (java) " + version, "item kinds: " + kinds };
    }
}
