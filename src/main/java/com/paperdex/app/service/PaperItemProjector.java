package com.paperdex.app.service;

import com.paperdex.app.model.ItemType;
import com.paperdex.app.model.Paper;
import com.paperdex.app.model.PaperKeys;
import com.paperdex.app.repository.dynamodb.PaperItem;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Fans one {@link Paper} out into its storage rows.
 *
 * <ul>
 *   <li>one {@code PAPER_DETAIL} row, the only row reachable through PaperIdIndex;
 *   <li>one {@code CATEGORY_ITEM} per category, keyed by category and dated sort key;
 *   <li>one {@code AUTHOR_ITEM} per distinct author, reachable through AuthorIndex;
 *   <li>one {@code KEYWORD_ITEM} per distinct extracted keyword, reachable through KeywordIndex.
 * </ul>
 *
 * <p>Author and category strings are used verbatim in keys. A missing publication timestamp places
 * the rows under {@link PaperKeys#MISSING_DATE}.
 */
public class PaperItemProjector {

  private final KeywordExtractor keywordExtractor;

  public PaperItemProjector(KeywordExtractor keywordExtractor) {
    this.keywordExtractor = Objects.requireNonNull(keywordExtractor, "keywordExtractor");
  }

  /**
   * @throws InvalidPaperException if the record has no arXiv id
   */
  public List<PaperItem> project(Paper paper) {
    String id = paper.getArxivId();
    if (id == null || id.isBlank()) {
      throw new InvalidPaperException("paper has no arxiv_id (title=" + paper.getTitle() + ")");
    }
    List<String> authors = orEmpty(paper.getAuthors());
    List<String> categories = orEmpty(paper.getCategories());
    String abstractText = paper.getAbstractText() == null ? "" : paper.getAbstractText();
    List<String> keywords = keywordExtractor.extract(abstractText);
    String published = paper.getPublished();
    String datedKey = PaperKeys.datedSortKey(PaperKeys.publishedDate(published), id);

    List<PaperItem> items = new ArrayList<>();
    items.add(
        PaperItem.builder()
            .pk(PaperKeys.paper(id))
            .sk(PaperKeys.DETAIL_MARKER)
            .gsi3pk(PaperKeys.paper(id))
            .gsi3sk(PaperKeys.DETAIL_MARKER)
            .arxivId(id)
            .title(paper.getTitle())
            .authors(authors)
            .abstractText(abstractText)
            .categories(categories)
            .keywords(keywords)
            .published(published)
            .itemType(ItemType.PAPER_DETAIL)
            .build());

    for (String category : categories) {
      items.add(
          PaperItem.builder()
              .pk(PaperKeys.category(category))
              .sk(datedKey)
              .arxivId(id)
              .title(paper.getTitle())
              .authors(authors)
              .abstractText(abstractText)
              .categories(categories)
              .keywords(keywords)
              .published(published)
              .itemType(ItemType.CATEGORY_ITEM)
              .build());
    }

    for (String author : new LinkedHashSet<>(authors)) {
      items.add(
          PaperItem.builder()
              .pk(PaperKeys.authorItem(author))
              .sk(datedKey)
              .gsi1pk(PaperKeys.author(author))
              .gsi1sk(datedKey)
              .arxivId(id)
              .title(paper.getTitle())
              .categories(categories)
              .published(published)
              .itemType(ItemType.AUTHOR_ITEM)
              .build());
    }

    for (String keyword : new LinkedHashSet<>(keywords)) {
      items.add(
          PaperItem.builder()
              .pk(PaperKeys.keywordItem(keyword))
              .sk(datedKey)
              .gsi2pk(PaperKeys.keyword(keyword))
              .gsi2sk(datedKey)
              .arxivId(id)
              .title(paper.getTitle())
              .categories(categories)
              .published(published)
              .itemType(ItemType.KEYWORD_ITEM)
              .build());
    }
    return items;
  }

  private static List<String> orEmpty(List<String> values) {
    return values == null ? List.of() : values;
  }
}
