package com.paperdex.app.service;

import com.paperdex.app.repository.dynamodb.PaperItem;
import lombok.Value;

/** A derived item together with the corpus position of the paper it came from. */
@Value
public class ProjectedItem {

  int paperIndex;

  PaperItem item;
}
