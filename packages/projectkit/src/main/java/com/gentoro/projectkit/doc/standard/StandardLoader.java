package com.gentoro.projectkit.doc.standard;

import com.gentoro.projectkit.loader.FlatFileLoader;
import com.gentoro.projectkit.loader.ResourceKind;

/** Loads one documentation {@link Standard} per YAML file. */
public class StandardLoader extends FlatFileLoader<Standard> {

  public StandardLoader() {
    super(ResourceKind.STANDARD, Standard.class, new StandardValidator());
  }
}
