package dev.letterfinder.pipeline;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Follow-up guidance for manual archival research, reported at the end of every run.
 *
 * @param archives archives holding likely material, with their contacts
 * @param searchStrategy ordered next steps for a researcher
 * @param searchTerms catalogue terms worth trying by hand
 * @param accessRequirements what each archive needs before granting API access
 * @param ocrProcess the automated document workflow, as steps
 * @param likelyTopics what the letter probably discussed, from its historical context
 */
public record ResearchPlan(
    List<ArchiveContact> archives,
    List<String> searchStrategy,
    List<String> searchTerms,
    List<String> accessRequirements,
    List<String> ocrProcess,
    List<String> likelyTopics) {

  public ResearchPlan {
    archives = List.copyOf(archives);
    searchStrategy = List.copyOf(searchStrategy);
    searchTerms = List.copyOf(searchTerms);
    accessRequirements = List.copyOf(accessRequirements);
    ocrProcess = List.copyOf(ocrProcess);
    likelyTopics = List.copyOf(likelyTopics);
  }

  /** An archive to contact, with the collections most likely to hold the letter. */
  public record ArchiveContact(
      String name,
      String location,
      List<String> collections,
      @Nullable String contact,
      @Nullable String requestProcedure) {

    public ArchiveContact {
      collections = List.copyOf(collections);
    }
  }

  /** The plan for Fairfax's November 1946 letter to Churchill. */
  public static ResearchPlan standard() {
    return new ResearchPlan(
        List.of(
            new ArchiveContact(
                "Churchill Archives Centre",
                "Churchill College, Cambridge, UK",
                List.of("CHAR (Chartwell Papers)", "CHUR (Churchill Papers)"),
                "archives@chu.cam.ac.uk",
                "Email with specific reference numbers and research purpose"),
            new ArchiveContact(
                "University of Toronto Archives",
                "Toronto, Canada",
                List.of("Gooderham Family fonds", "Fairfax family papers"),
                "utarms@utoronto.ca",
                null),
            new ArchiveContact(
                "Library and Archives Canada",
                "Ottawa, Canada",
                List.of("Military Personnel Records", "Canadian Expeditionary Force"),
                null,
                null)),
        List.of(
            "Query Churchill Archives CALM catalogue for correspondence from Fairfax, Oct-Dec 1946",
            "Request specific CHAR files containing personal correspondence from this period",
            "Search Canadian archives for Fairfax's personal papers or letter copies",
            "Contact Fairfax/Gooderham family descendants for private collections",
            "Search newspaper archives for any mention of communication between the two"),
        List.of(
            "Fairfax, Bryan Charles",
            "Colonel Fairfax",
            "Fairfax + Churchill + 1946",
            "Canadian Battalion + Churchill + correspondence",
            "Gooderham + Churchill"),
        List.of(
            "Churchill Archives Centre requires registration and API key",
            "Library and Archives Canada requires institutional access",
            "University of Toronto Archives requires research request approval"),
        List.of(
            "Download document images from archive APIs",
            "Process images with OCR to extract text",
            "Analyze text for relevance to Fairfax-Churchill correspondence",
            "Extract letter components (date, salutation, body, signature)",
            "Validate letter content against historical context"),
        List.of(
            "Reflections on Churchill's 'Iron Curtain' speech (March 1946)",
            "Comments on Churchill's opposition leadership in Parliament",
            "Shared memories from military service",
            "Discussion of post-war international relations",
            "Possible mention of Churchill's upcoming history of WWII",
            "News of Toronto social and political circles",
            "Personal reflections on Fairfax's military career and Churchill's leadership"));
  }
}
