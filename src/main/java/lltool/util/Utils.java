package lltool.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Class with utility methods...
 */
public class Utils {

	public static String join(Collection<?> objs, String joiner){
		return objs.stream().map(Object::toString).collect(Collectors.joining(joiner));
	}

	@SafeVarargs
	public static <T> Set<T> set(T... elements){
		return new LinkedHashSet<>(Arrays.asList(elements));
	}

	public static <T extends Comparable<? super T>> List<T> sorted(Collection<T> elements){
		List<T> list = new ArrayList<>(elements);
		Collections.sort(list);
		return list;
	}

	/**
	 * Formats the collection in the set notation <pre>{ a, b }</pre>, sorting the elements
	 */
	public static <T extends Comparable<? super T>> String formatSet(Collection<T> elements){
		if (elements.isEmpty()){
			return "{ }";
		}
		return "{ " + join(sorted(elements), ", ") + " }";
	}
}
