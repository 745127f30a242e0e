/*
 * Copyright (c) 2024-2025 The pumpprobe Development Team
 *
 * Permission is hereby granted, free of charge, to any person
 * obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without
 * restriction, including without limitation the rights to use,
 * copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the
 * Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be
 * included in all copies or substantial portions of the Software.
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
 * EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND
 * NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY,
 * WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING
 * FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR
 * OTHER DEALINGS IN THE SOFTWARE.
 */

package io.github.pumpprobe.parameters.impl;

import io.github.pumpprobe.parameters.Parameter;
import io.github.pumpprobe.parameters.ParameterSet;
import io.github.pumpprobe.parameters.parametertypes.ParameterSetParameter;
import java.lang.reflect.InvocationTargetException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;
import org.jetbrains.annotations.NotNull;
import org.json.JSONObject;

/**
 * Parameter set backed by clones of the parameters passed to the constructor. Subclasses declare
 * their parameters as static templates and pass them to {@code super}.
 */
public class SimpleParameterSet implements ParameterSet {

  private static final Logger logger = Logger.getLogger(SimpleParameterSet.class.getName());

  private final Map<String, Parameter<?>> parameters = new LinkedHashMap<>();

  public SimpleParameterSet(Parameter<?>... parameters) {
    for (Parameter<?> p : parameters) {
      final Parameter<?> clone = p.cloneParameter();
      if (this.parameters.put(clone.getName(), clone) != null) {
        throw new IllegalArgumentException("Duplicate parameter name " + clone.getName());
      }
    }
  }

  @Override
  public Parameter<?> @NotNull [] getParameters() {
    return parameters.values().toArray(new Parameter<?>[0]);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <P extends Parameter<?>> @NotNull P getParameter(@NotNull P parameter) {
    final Parameter<?> own = parameters.get(parameter.getName());
    if (own == null) {
      throw new IllegalArgumentException(
          "Parameter " + parameter.getName() + " is not part of " + getClass().getSimpleName());
    }
    return (P) own;
  }

  @Override
  public boolean checkParameterValues(@NotNull Collection<String> errorMessages) {
    boolean valid = true;
    for (Parameter<?> p : parameters.values()) {
      valid &= p.checkValue(errorMessages);
    }
    return valid;
  }

  @Override
  public @NotNull ParameterSet cloneParameterSet() {
    final SimpleParameterSet clone;
    try {
      clone = getClass() == SimpleParameterSet.class ? new SimpleParameterSet()
          : getClass().getDeclaredConstructor().newInstance();
    } catch (InstantiationException | IllegalAccessException | NoSuchMethodException
             | InvocationTargetException e) {
      throw new IllegalStateException("Cannot clone parameter set " + getClass().getName(), e);
    }
    clone.parameters.clear();
    for (Parameter<?> p : parameters.values()) {
      clone.parameters.put(p.getName(), p.cloneParameter());
    }
    return clone;
  }

  @Override
  public void loadValuesFromProperties(@NotNull Properties properties, @NotNull String prefix) {
    for (Parameter<?> p : parameters.values()) {
      if (p instanceof ParameterSetParameter<?> nested) {
        nested.getValue().loadValuesFromProperties(properties, prefix + p.getName() + ".");
        continue;
      }
      final String value = properties.getProperty(prefix + p.getName());
      if (value != null) {
        p.loadValueFromString(value.trim());
        logger.fine(() -> "Loaded " + p.getName() + " = " + value);
      }
    }
  }

  @Override
  public @NotNull JSONObject toJson() {
    final JSONObject json = new JSONObject();
    for (Parameter<?> p : parameters.values()) {
      final Object value = p.getValueForExport();
      json.put(p.getName(), value == null ? JSONObject.NULL : value);
    }
    return json;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + toJson();
  }
}
