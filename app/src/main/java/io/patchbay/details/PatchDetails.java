package io.patchbay.details;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.patchbay.git.GitFileChange;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** What the view renders for the selected patch. {@code files} is null until the diff has been parsed. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LocalPatchDetails.class, name = "local"),
    @JsonSubTypes.Type(value = CloudPatchDetails.class, name = "cloud")
})
public sealed interface PatchDetails permits LocalPatchDetails, CloudPatchDetails {

    @Nullable
    String message();

    @Nullable
    List<GitFileChange> files();

    @Nullable
    String repoPath();

    List<Autolink> autolinks();

    @Nullable
    DerivationError autolinkError();
}
