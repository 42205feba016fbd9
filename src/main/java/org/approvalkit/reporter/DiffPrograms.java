package org.approvalkit.reporter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Known diff and merge tools, in the order the default reporter tries them.
 */
public final class DiffPrograms {
    private static final List<String> RECEIVED_APPROVED = List.of("%received", "%approved");

    public static final DiffProgram BEYOND_COMPARE = new DiffProgram(
            "beyondcompare",
            List.of("bcompare", "/Applications/Beyond Compare.app/Contents/MacOS/bcomp",
                    "C:/Program Files/Beyond Compare 4/BCompare.exe"),
            RECEIVED_APPROVED);
    public static final DiffProgram INTELLIJ = new DiffProgram(
            "intellij",
            List.of("idea", "/Applications/IntelliJ IDEA.app/Contents/MacOS/idea"),
            List.of("diff", "%received", "%approved"));
    public static final DiffProgram VS_CODE = new DiffProgram(
            "vscode",
            List.of("code", "/Applications/Visual Studio Code.app/Contents/Resources/app/bin/code"),
            List.of("-d", "%received", "%approved"));
    public static final DiffProgram KDIFF3 = new DiffProgram(
            "kdiff3",
            List.of("kdiff3", "/Applications/kdiff3.app/Contents/MacOS/kdiff3", "C:/Program Files/KDiff3/kdiff3.exe"),
            List.of("%received", "%approved", "-m"));
    public static final DiffProgram MELD = new DiffProgram(
            "meld",
            List.of("meld", "/Applications/Meld.app/Contents/MacOS/Meld"),
            RECEIVED_APPROVED);
    public static final DiffProgram P4MERGE = new DiffProgram(
            "p4merge",
            List.of("p4merge", "/Applications/p4merge.app/Contents/MacOS/p4merge",
                    "C:/Program Files/Perforce/p4merge.exe"),
            List.of("%received", "%approved", "%approved", "%approved"));
    public static final DiffProgram DIFFMERGE = new DiffProgram(
            "diffmerge",
            List.of("diffmerge", "/Applications/DiffMerge.app/Contents/MacOS/DiffMerge",
                    "C:/Program Files/SourceGear/Common/DiffMerge/sgdm.exe"),
            List.of("--nosplash", "%received", "%approved"));
    public static final DiffProgram WINMERGE = new DiffProgram(
            "winmerge",
            List.of("C:/Program Files/WinMerge/WinMergeU.exe", "C:/Program Files (x86)/WinMerge/WinMergeU.exe"),
            List.of("/u", "%received", "%approved"));
    public static final DiffProgram TORTOISE_MERGE = new DiffProgram(
            "tortoisemerge",
            List.of("C:/Program Files/TortoiseSVN/bin/TortoiseMerge.exe",
                    "C:/Program Files/TortoiseGit/bin/TortoiseGitMerge.exe"),
            RECEIVED_APPROVED);
    public static final DiffProgram OPENDIFF = new DiffProgram(
            "opendiff",
            List.of("/usr/bin/opendiff"),
            RECEIVED_APPROVED);

    private static final List<DiffProgram> ALL = List.of(
            BEYOND_COMPARE,
            INTELLIJ,
            VS_CODE,
            KDIFF3,
            MELD,
            P4MERGE,
            DIFFMERGE,
            WINMERGE,
            TORTOISE_MERGE,
            OPENDIFF);

    private DiffPrograms() {}

    public static List<DiffProgram> all() {
        return ALL;
    }

    public static Optional<DiffProgram> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return ALL.stream().filter(program -> program.name().equals(normalized)).findFirst();
    }
}
