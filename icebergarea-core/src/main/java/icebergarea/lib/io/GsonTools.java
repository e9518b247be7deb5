/*-
 * #%L
 * This file is part of IcebergArea.
 * %%
 * Copyright (C) 2024 IcebergArea developers
 * %%
 * IcebergArea is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * IcebergArea is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with IcebergArea.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package icebergarea.lib.io;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

/**
 * Helper class providing Gson instances with type adapters registered for key classes.
 * <p>
 * Java Topology Suite geometries are written and read as GeoJSON geometry objects.
 * Special floating point values (NaN, infinity) are permitted, since unavailable measurements are represented as NaN.
 */
public class GsonTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static final GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapterFactory(new IcebergAreaTypeAdapterFactory());
	
	private GsonTools() {
		throw new AssertionError();
	}
	
	/**
	 * Access the builder used with {@link #getInstance()}.
	 * This makes it possible to register new type adapters, which will be used by future Gson instances 
	 * returned by this class.
	 * <p>
	 * To create a derived builder that does not change the default, use {@code getDefaultBuilder().create().newBuilder()}.
	 * 
	 * @return
	 */
	public static synchronized GsonBuilder getDefaultBuilder() {
		return builder;
	}
	
	static class IcebergAreaTypeAdapterFactory implements TypeAdapterFactory {

		@SuppressWarnings("unchecked")
		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			if (Geometry.class.isAssignableFrom(type.getRawType()))
				return (TypeAdapter<T>)GeoJsonTypeAdapters.GEOMETRY_ADAPTER_INSTANCE.nullSafe();
			return null;
		}
		
	}
	
	/**
	 * Create a {@link TypeAdapterFactory} that is suitable for handling class hierarchies.
	 * This can be used to construct the appropriate subtype when parsing the JSON by using a specific field in the JSON representation.
	 * 
	 * @param <T>
	 * @param baseType the base type, i.e. the class or interface that all types descend from
	 * @param typeFieldName a field name to include within the serialized JSON object to identify the specific type
	 * @return
	 */
	public static <T> SubTypeAdapterFactory<T> createSubTypeAdapterFactory(Class<T> baseType, String typeFieldName) {
		return new SubTypeAdapterFactory<>(baseType, typeFieldName);
	}
	
	/**
	 * A {@link TypeAdapterFactory} for class hierarchies, where the concrete type is named by a label field.
	 * The label is written as the first field of the object, and removed again before the subtype is read.
	 * Alias labels are accepted when reading, but never written.
	 *
	 * @param <T>
	 */
	public static class SubTypeAdapterFactory<T> implements TypeAdapterFactory {

		private final Class<T> baseType;
		private final String typeFieldName;
		private final Map<String, Class<? extends T>> subtypes = new LinkedHashMap<>();
		private final Map<String, Class<? extends T>> aliases = new LinkedHashMap<>();

		private SubTypeAdapterFactory(Class<T> baseType, String typeFieldName) {
			this.baseType = Objects.requireNonNull(baseType, "Base type must not be null");
			this.typeFieldName = Objects.requireNonNull(typeFieldName, "Type field name must not be null");
		}

		@SuppressWarnings("unchecked")
		@Override
		public synchronized <R> TypeAdapter<R> create(Gson gson, TypeToken<R> type) {
			if (type.getRawType() != baseType)
				return null;
			Map<Class<?>, TypeAdapter<?>> delegates = new LinkedHashMap<>();
			for (var subtype : subtypes.values())
				delegates.put(subtype, gson.getDelegateAdapter(this, TypeToken.get(subtype)));
			return (TypeAdapter<R>)new LabeledAdapter(gson, Map.copyOf(subtypes), Map.copyOf(aliases), delegates).nullSafe();
		}
		
		private class LabeledAdapter extends TypeAdapter<T> {

			private final Gson gson;
			private final Map<String, Class<? extends T>> labels;
			private final Map<String, Class<? extends T>> aliasLabels;
			private final Map<Class<?>, TypeAdapter<?>> delegates;

			private LabeledAdapter(Gson gson, Map<String, Class<? extends T>> labels,
					Map<String, Class<? extends T>> aliasLabels, Map<Class<?>, TypeAdapter<?>> delegates) {
				this.gson = gson;
				this.labels = labels;
				this.aliasLabels = aliasLabels;
				this.delegates = delegates;
			}
			
			private String labelFor(Class<?> subtype) {
				for (var entry : labels.entrySet()) {
					if (entry.getValue() == subtype)
						return entry.getKey();
				}
				return null;
			}
			
			@SuppressWarnings("unchecked")
			private TypeAdapter<T> delegateFor(Class<?> subtype) {
				return subtype == null ? null : (TypeAdapter<T>)delegates.get(subtype);
			}

			@Override
			public void write(JsonWriter out, T value) throws IOException {
				var delegate = delegateFor(value.getClass());
				String label = labelFor(value.getClass());
				if (delegate == null || label == null)
					throw new JsonParseException("No label registered for " + value.getClass().getName() + " as a " + baseType.getSimpleName());
				JsonObject fields = delegate.toJsonTree(value).getAsJsonObject();
				if (fields.has(typeFieldName))
					throw new JsonParseException(value.getClass().getName() + " already has a field named " + typeFieldName);
				JsonObject labeled = new JsonObject();
				labeled.addProperty(typeFieldName, label);
				fields.entrySet().forEach(e -> labeled.add(e.getKey(), e.getValue()));
				gson.toJson(labeled, out);
			}

			@Override
			public T read(JsonReader in) throws IOException {
				JsonElement element = gson.fromJson(in, JsonElement.class);
				if (element == null || !element.isJsonObject())
					throw new JsonParseException("Expected a JSON object for " + baseType.getSimpleName() + ", but got " + element);
				JsonElement labelElement = element.getAsJsonObject().remove(typeFieldName);
				if (labelElement == null || !labelElement.isJsonPrimitive())
					throw new JsonParseException("Missing " + typeFieldName + " for " + baseType.getSimpleName());
				String label = labelElement.getAsString();
				var delegate = delegateFor(labels.getOrDefault(label, aliasLabels.get(label)));
				if (delegate == null)
					throw new JsonParseException("Unknown " + typeFieldName + " '" + label + "' for " + baseType.getSimpleName());
				logger.trace("Reading {} as {}", baseType.getSimpleName(), label);
				return delegate.fromJsonTree(element);
			}
		}

		/**
		 * Register a subtype with the label used to write it.
		 * 
		 * @param subtype the subtype to register
		 * @param label unique label identifying the subtype
		 * @return this factory
		 */
		public synchronized SubTypeAdapterFactory<T> registerSubtype(Class<? extends T> subtype, String label) {
			Objects.requireNonNull(subtype, "Subtype must not be null");
			Objects.requireNonNull(label, "Label must not be null");
			if (subtypes.containsKey(label))
				throw new IllegalArgumentException("Label " + label + " is already registered for " + subtypes.get(label).getName());
			subtypes.put(label, subtype);
			return this;
		}

		/**
		 * Register an alternative label that is accepted when reading a subtype.
		 * 
		 * @param subtype the subtype
		 * @param alias the alternative label
		 * @return this factory
		 */
		public synchronized SubTypeAdapterFactory<T> registerAlias(Class<? extends T> subtype, String alias) {
			Objects.requireNonNull(subtype, "Subtype must not be null");
			Objects.requireNonNull(alias, "Alias must not be null");
			var previous = aliases.put(alias, subtype);
			if (previous != null && previous != subtype)
				logger.warn("Alias {} now refers to {} instead of {}", alias, subtype.getName(), previous.getName());
			return this;
		}

	}
	
	/**
	 * Get the default Gson instance.
	 * @return
	 * 
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return getDefaultBuilder().create();
	}
	
	/**
	 * Get the default Gson, optionally with pretty printing enabled.
	 * 
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}

}
