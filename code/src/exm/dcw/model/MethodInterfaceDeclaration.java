/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.dcw.model;

import com.google.common.base.Preconditions;

/**
 * Declaration of a method in a class or interface type
 * */
public class MethodInterfaceDeclaration
{
  public static enum Binding {
    STATIC, VIRTUAL, OVERRIDE
  }

  private final Prototype prototype;
  private final Binding binding;
  private final AnnotationComment comment;

  public MethodInterfaceDeclaration(Prototype prototype, Binding binding,
                                    AnnotationComment comment)
  {
    this.prototype = Preconditions.checkNotNull(prototype);
    this.binding = Preconditions.checkNotNull(binding);
    this.comment = comment;
  }

  public MethodInterfaceDeclaration(Prototype prototype)
  {
    this(prototype, Binding.STATIC, null);
  }

  public Prototype getPrototype()
  {
    return prototype;
  }

  public Binding getBinding()
  {
    return binding;
  }

  /**
   * @return null if there is no comment
   */
  public AnnotationComment getComment()
  {
    return comment;
  }
}
